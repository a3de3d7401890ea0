package lgen;

import lgen.errors.TopLevelIssueContext;
import lgen.model.il.InstructionSequence;
import lgen.model.ladder.LadderProgram;
import lgen.model.ladder.LadderRung;
import lgen.model.timing.DetectedPattern;
import lgen.model.timing.TimingAnalysis;
import lgen.model.timing.TimingDescription;
import lgen.trans.LGenTransException;
import lgen.trans.passes.analysis.TimingAnalysisPass;
import lgen.trans.passes.codegen.LadderCompilePass;
import lgen.trans.passes.parse.option.OptionParsingPass;
import lgen.trans.passes.parse.timing.TimingDescriptionParsingPass;
import lgen.trans.passes.synthesis.SynthesisPass;
import lgen.trans.passes.validation.InstructionValidationPass;
import lgen.trans.patterns.PatternRegistry;
import org.apache.commons.io.FileUtils;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;
import java.util.logging.Logger;

public class LGenMain {
	private String[] cmdArgs;
	// the top Logger instance
	private static final Logger logger = Logger.getLogger("LGenMain");

	public LGenMain(String[] args) {
		cmdArgs = args;
	}

	// Creates a LGenMain instance, and initiates run() below.
	public static void main(String[] args) {
		if (new LGenMain(args).run()) {
			logger.info("Finished");
		} else {
			logger.info("Terminated with errors");
			System.exit(1);
		}
	}

	/**
	 * Synthesizes, compiles and validates a program. Validation issues are fatal here
	 * because the result is about to be written out.
	 */
	static InstructionSequence generate(TopLevelIssueContext ctx, TimingDescription timing, PatternRegistry registry,
										LGenOptions opts) throws LGenTransException {
		logger.info("Synthesizing ladder program");
		LadderProgram program = SynthesisPass.perform(timing, registry, opts.programName, opts.deviceStart);
		logger.info("Generated " + program.getRungs().size() + " rung(s) using " + program.getPatternTags());
		for (LadderRung rung : program.getRungs()) {
			logger.fine(rung.toString());
		}

		logger.info("Compiling to instruction list");
		InstructionSequence sequence = LadderCompilePass.perform(program);

		logger.info("Validating instruction list");
		InstructionValidationPass.perform(ctx, sequence);
		checkErrors(ctx);
		return sequence;
	}

	private static void printAnalysis(TimingAnalysis analysis) {
		for (String warning : analysis.getWarnings()) {
			logger.warning(warning);
		}
		if (analysis.getDetectedPatterns().isEmpty()) {
			System.out.println("no patterns detected");
		}
		for (DetectedPattern pattern : analysis.getDetectedPatterns()) {
			System.out.println(pattern);
		}
	}

	// Top-level workhorse method.
	public boolean run() {
		try {
			TopLevelIssueContext ctx = new TopLevelIssueContext();

			// Check options, set up logging.
			LGenOptions opts = OptionParsingPass.perform(ctx, logger, cmdArgs);
			if (ctx.hasErrors()) {
				System.err.println(ctx.format());
				opts.printHelp();
				return false;
			}

			logger.info("Parsing timing description");
			TimingDescription timing = TimingDescriptionParsingPass.perform(ctx, Paths.get(opts.inputFilePath));
			checkErrors(ctx);

			logger.info("Analysing timing description");
			TimingAnalysis analysis = TimingAnalysisPass.perform(timing);
			if (opts.analyseOnly) {
				printAnalysis(analysis);
				return true;
			}
			for (String warning : analysis.getWarnings()) {
				logger.warning(warning);
			}

			InstructionSequence sequence = generate(ctx, timing, PatternRegistry.createDefault(), opts);

			String destFile = opts.getDestFile();
			if (destFile == null) {
				System.out.println(sequence);
			} else {
				logger.info("Writing instruction list to \"" + destFile + "\"");
				FileUtils.writeLines(new File(destFile), StandardCharsets.UTF_8.name(), sequence.toLines());
			}
		} catch (LGenException | IOException e) {
			logger.severe("found issues");
			System.err.println(e.getMessage());
			return false;
		}

		return true;
	}

	private static void checkErrors(TopLevelIssueContext ctx) throws LGenTransException {
		if (ctx.hasErrors()) {
			throw new LGenTransException(ctx);
		}
	}
}
