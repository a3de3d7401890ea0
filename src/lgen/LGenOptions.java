package lgen;

import lgen.model.device.DeviceType;
import org.apache.commons.io.FileUtils;
import org.json.JSONException;
import org.json.JSONObject;
import org.plumelib.options.Option;
import org.plumelib.options.Options;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

public class LGenOptions {
	public static final String VERSION = "0.3.0";

	@Option(value = "Version", aliases = {"-version"})
	public boolean version = false;

	@Option(value = "-h Print usage information", aliases = { "-help" })
	public boolean help = false;

	@Option(value = "-q Reduce printing during execution", aliases = { "-quiet" })
	public boolean logLvlQuiet = false;

	/**
	 * Be verbose, print extra detailed information. Sets the log level to FINE.
	 */
	@Option(value = "-v Print detailed information during execution ", aliases = { "-verbose" })
	public boolean logLvlVerbose = false;

	@Option(value = "-a Only analyse the timing description, do not generate a program", aliases = { "-analyse" })
	public boolean analyseOnly = false;

	@Option(value = "-c path to the configuration file, if any")
	public String configFilePath;

	public String inputFilePath;

	// fields extracted from the JSON configuration file
	public String programName = "MAIN";
	public String buildDir;
	public String buildFile;
	public Map<DeviceType, Integer> deviceStart = Collections.emptyMap();

	private Options plumeOptions;
	private String[] remainingArgs;

	public void printHelp() {
		plumeOptions.printUsage();
	}

	public LGenOptions(String[] args) {
		plumeOptions = new Options("lgen [options] timing.json", this);
		// prints usage and exits when the command line does not parse
		remainingArgs = plumeOptions.parse(true, args);
	}

	public void parse() throws LGenOptionException {
		if (version) {
			System.out.println("lgen version " + VERSION);
			System.exit(0);
		}

		if (help || remainingArgs.length != 1) {
			printHelp();
			System.exit(0);
		}

		inputFilePath = remainingArgs[0];

		if (configFilePath == null || configFilePath.isEmpty()) {
			return;
		}

		String s;
		try {
			s = FileUtils.readFileToString(new File(configFilePath), StandardCharsets.UTF_8);
		} catch (IOException ex) {
			throw new LGenOptionException("Error reading configuration file: " + ex.getMessage());
		}

		JSONObject config;
		try {
			config = new JSONObject(s);
		} catch (JSONException e) {
			throw new LGenOptionException(configFilePath + ": parsing error: " + e.getMessage());
		}
		readConfig(config);
	}

	/**
	 * Every section of the configuration is optional:
	 *
	 * <pre>
	 * {
	 *   "program": {"name": "MAIN"},
	 *   "build": {"output_dir": "out", "dest_file": "main.il"},
	 *   "device_start": {"M": 100, "T": 10}
	 * }
	 * </pre>
	 */
	public void readConfig(JSONObject config) throws LGenOptionException {
		try {
			JSONObject program = config.optJSONObject("program");
			if (program != null) {
				programName = program.optString("name", programName);
			}
			JSONObject build = config.optJSONObject("build");
			if (build != null) {
				buildDir = build.has("output_dir") ? build.getString("output_dir") : null;
				buildFile = build.has("dest_file") ? build.getString("dest_file") : null;
			}
			JSONObject start = config.optJSONObject("device_start");
			if (start != null) {
				Map<DeviceType, Integer> addresses = new EnumMap<>(DeviceType.class);
				for (String key : start.keySet()) {
					DeviceType type;
					try {
						type = DeviceType.valueOf(key);
					} catch (IllegalArgumentException e) {
						throw new LGenOptionException("device_start: unknown device type " + key);
					}
					int address = start.getInt(key);
					if (address < 0 || address >= type.getCapacity()) {
						throw new LGenOptionException("device_start: " + key + " start " + address +
								" is outside 0.." + (type.getCapacity() - 1));
					}
					addresses.put(type, address);
				}
				deviceStart = addresses;
			}
		} catch (JSONException e) {
			throw new LGenOptionException(configFilePath + ": " + e.getMessage());
		}
	}

	/**
	 * @return where to write the instruction list, or null to write it to standard output
	 */
	public String getDestFile() {
		if (buildFile == null) {
			return null;
		}
		if (buildDir == null) {
			return buildFile;
		}
		return buildDir + "/" + buildFile;
	}
}
