package lgen;

import lgen.model.device.DeviceType;
import org.apache.commons.io.FileUtils;
import org.json.JSONObject;
import org.junit.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

public class LGenOptionsTest {

	private static LGenOptions options() {
		return new LGenOptions(new String[] {});
	}

	@Test
	public void testDefaults() {
		LGenOptions opts = options();
		assertThat(opts.programName, is("MAIN"));
		assertTrue(opts.deviceStart.isEmpty());
		assertThat(opts.getDestFile(), is(nullValue()));
	}

	@Test
	public void testCommandLineFlags() {
		LGenOptions opts = new LGenOptions(new String[] {"-q", "-a", "-c", "lgen.json", "timing.json"});
		assertTrue(opts.logLvlQuiet);
		assertTrue(opts.analyseOnly);
		assertFalse(opts.logLvlVerbose);
		assertThat(opts.configFilePath, is("lgen.json"));
	}

	@Test
	public void testReadConfig() throws IOException, LGenOptionException {
		String text = FileUtils.readFileToString(Paths.get("test", "config", "lgen.json").toFile(),
				StandardCharsets.UTF_8);
		LGenOptions opts = options();
		opts.readConfig(new JSONObject(text));
		assertThat(opts.programName, is("LINE1"));
		assertThat(opts.getDestFile(), is("out/line1.il"));
		assertThat(opts.deviceStart.get(DeviceType.M), is(50));
		assertThat(opts.deviceStart.get(DeviceType.T), is(10));
		assertFalse(opts.deviceStart.containsKey(DeviceType.X));
	}

	@Test
	public void testDestFileWithoutDirectory() throws LGenOptionException {
		LGenOptions opts = options();
		opts.readConfig(new JSONObject("{\"build\": {\"dest_file\": \"main.il\"}}"));
		assertThat(opts.getDestFile(), is("main.il"));
	}

	@Test
	public void testUnknownDeviceType() {
		try {
			options().readConfig(new JSONObject("{\"device_start\": {\"Q\": 1}}"));
			fail("expected an option error");
		} catch (LGenOptionException e) {
			assertThat(e.getMessage(), containsString("unknown device type Q"));
		}
	}

	@Test(expected = LGenOptionException.class)
	public void testStartOutOfRange() throws LGenOptionException {
		options().readConfig(new JSONObject("{\"device_start\": {\"M\": 100}}"));
	}

	@Test(expected = LGenOptionException.class)
	public void testStartNotANumber() throws LGenOptionException {
		options().readConfig(new JSONObject("{\"device_start\": {\"T\": \"ten\"}}"));
	}
}
