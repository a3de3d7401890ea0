package lgen.trans.passes.parse.timing;

import lgen.errors.IssueContext;
import lgen.model.timing.*;
import lgen.trans.passes.parse.IOErrorIssue;
import org.apache.commons.io.FileUtils;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reads a timing description from JSON:
 *
 * <pre>
 * {
 *   "description": "...",
 *   "inputs":    [{"name": "PB1", "type": "push_button", "mode": "momentary", "comment": "..."}],
 *   "outputs":   [{"name": "RL", "type": "lamp", "comment": "..."}],
 *   "sequences": [{"trigger": "PB1", "action": "RL ON", "delay": 5}]
 * }
 * </pre>
 *
 * Every problem found is reported; entries with problems are left out of the result.
 */
public class TimingDescriptionParsingPass {
	private TimingDescriptionParsingPass() {}

	/**
	 * @return the parsed description, or null if the file could not be read or is not a JSON object
	 */
	public static TimingDescription perform(IssueContext ctx, Path path) {
		String text;
		try {
			text = FileUtils.readFileToString(path.toFile(), StandardCharsets.UTF_8);
		} catch (IOException e) {
			ctx.error(new IOErrorIssue(path, e));
			return null;
		}
		return perform(ctx, text);
	}

	public static TimingDescription perform(IssueContext ctx, String text) {
		JSONObject root;
		try {
			root = new JSONObject(text);
		} catch (JSONException e) {
			ctx.error(new TimingParserIssue("", e.getMessage()));
			return null;
		}

		List<InputDeclaration> inputs = new ArrayList<>();
		JSONArray inputArray = optArray(ctx, root, "inputs");
		for (int i = 0; i < inputArray.length(); i++) {
			String location = "inputs[" + i + "]";
			JSONObject entry = inputArray.optJSONObject(i);
			if (entry == null) {
				ctx.error(new TimingParserIssue(location, "expected an object"));
				continue;
			}
			String name = requireString(ctx, entry, location, "name");
			String type = entry.optString("type", InputKind.PUSH_BUTTON.getExternalName());
			String mode = entry.optString("mode", ActuationMode.MOMENTARY.getExternalName());
			Optional<InputKind> kind = InputKind.fromExternalName(type);
			Optional<ActuationMode> actuation = ActuationMode.fromExternalName(mode);
			if (!kind.isPresent()) {
				ctx.error(new TimingParserIssue(location + ".type", "unknown input type \"" + type + "\""));
			}
			if (!actuation.isPresent()) {
				ctx.error(new TimingParserIssue(location + ".mode", "unknown input mode \"" + mode + "\""));
			}
			if (name != null && kind.isPresent() && actuation.isPresent()) {
				inputs.add(new InputDeclaration(name, kind.get(), actuation.get(), entry.optString("comment", "")));
			}
		}

		List<OutputDeclaration> outputs = new ArrayList<>();
		JSONArray outputArray = optArray(ctx, root, "outputs");
		for (int i = 0; i < outputArray.length(); i++) {
			String location = "outputs[" + i + "]";
			JSONObject entry = outputArray.optJSONObject(i);
			if (entry == null) {
				ctx.error(new TimingParserIssue(location, "expected an object"));
				continue;
			}
			String name = requireString(ctx, entry, location, "name");
			String type = entry.optString("type", OutputKind.LAMP.getExternalName());
			Optional<OutputKind> kind = OutputKind.fromExternalName(type);
			if (!kind.isPresent()) {
				ctx.error(new TimingParserIssue(location + ".type", "unknown output type \"" + type + "\""));
			}
			if (name != null && kind.isPresent()) {
				outputs.add(new OutputDeclaration(name, kind.get(), entry.optString("comment", "")));
			}
		}

		List<SequenceStep> steps = new ArrayList<>();
		JSONArray stepArray = optArray(ctx, root, "sequences");
		for (int i = 0; i < stepArray.length(); i++) {
			String location = "sequences[" + i + "]";
			JSONObject entry = stepArray.optJSONObject(i);
			if (entry == null) {
				ctx.error(new TimingParserIssue(location, "expected an object"));
				continue;
			}
			String trigger = requireString(ctx, entry, location, "trigger");
			String action = requireString(ctx, entry, location, "action");
			Double delay = null;
			boolean delayValid = true;
			if (entry.has("delay") && !entry.isNull("delay")) {
				Object value = entry.get("delay");
				if (value instanceof Number) {
					delay = ((Number) value).doubleValue();
				} else {
					ctx.error(new TimingParserIssue(location + ".delay", "expected a number of seconds"));
					delayValid = false;
				}
			}
			if (trigger != null && action != null && delayValid) {
				steps.add(new SequenceStep(trigger, action, delay));
			}
		}

		return new TimingDescription(root.optString("description", ""), inputs, outputs, steps);
	}

	private static JSONArray optArray(IssueContext ctx, JSONObject root, String key) {
		if (!root.has(key) || root.isNull(key)) {
			return new JSONArray();
		}
		JSONArray array = root.optJSONArray(key);
		if (array == null) {
			ctx.error(new TimingParserIssue(key, "expected an array"));
			return new JSONArray();
		}
		return array;
	}

	private static String requireString(IssueContext ctx, JSONObject entry, String location, String key) {
		Object value = entry.opt(key);
		if (!(value instanceof String) || ((String) value).trim().isEmpty()) {
			ctx.error(new TimingParserIssue(location + "." + key, "missing " + key));
			return null;
		}
		return (String) value;
	}
}
