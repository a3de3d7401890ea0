package lgen.trans.passes.parse.option;

import lgen.LGenOptionException;
import lgen.LGenOptions;
import lgen.errors.IssueContext;

import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Parses the command line and the optional configuration file, then sets the verbosity:
 * -q keeps warnings only, -v adds the per-rung trace.
 */
public class OptionParsingPass {
	private OptionParsingPass() {}

	public static LGenOptions perform(IssueContext ctx, Logger logger, String[] args) {
		LGenOptions opts = new LGenOptions(args);
		try {
			opts.parse();
		} catch (LGenOptionException e) {
			ctx.error(new OptionParserIssue(e.getMessage()));
		}

		Level level = Level.INFO;
		if (opts.logLvlQuiet) {
			level = Level.WARNING;
		} else if (opts.logLvlVerbose) {
			level = Level.FINE;
		}
		logger.setLevel(level);
		// records are published by the root logger's console handler, which filters at INFO otherwise
		for (Handler handler : Logger.getLogger("").getHandlers()) {
			handler.setLevel(level);
		}

		logger.fine("program name " + opts.programName + ", device start " + opts.deviceStart);
		return opts;
	}
}
