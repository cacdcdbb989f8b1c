package typespec;

import org.apache.commons.io.FileUtils;
import typespec.errors.Diagnostic;
import typespec.errors.Issue;
import typespec.trans.passes.parse.option.OptionParsingPass;

import java.io.File;
import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.logging.Level;
import java.util.logging.Logger;

public class TypeSpecMain {
	// options or input that could not be used
	public static final int EXIT_USAGE = 1;
	private static final int MAX_EXIT_CODE = 255;

	private final String[] cmdArgs;
	private static Logger logger;

	public TypeSpecMain(String[] args) {
		cmdArgs = args;
		// the parent of every pass logger
		logger = Logger.getLogger("typespec");
	}

	public static void main(String[] args) {
		// diagnostics contain Greek letters
		PrintStream out = new PrintStream(new FileOutputStream(FileDescriptor.out), true, StandardCharsets.UTF_8);
		int status = new TypeSpecMain(args).run(out);
		if (status == 0) {
			logger.info("Finished");
		} else {
			logger.info("Terminated with errors");
		}
		System.exit(status);
	}

	/**
	 * Checks the input file, printing one diagnostic message per line to out.
	 *
	 * @return 0 if the document is valid, otherwise the number of diagnostics capped at 255
	 */
	public int run(PrintStream out) {
		TypeSpecOptions opts;
		try {
			opts = OptionParsingPass.perform(logger, cmdArgs);
		} catch (TypeSpecOptionException e) {
			System.err.println(e.getMessage());
			return EXIT_USAGE;
		}
		if (opts.version) {
			out.println("typespec version " + TypeSpecOptions.VERSION);
			return 0;
		}
		if (opts.help) {
			opts.printHelp();
			return 0;
		}

		logger.info("Opening source file");
		String text;
		try {
			text = FileUtils.readFileToString(new File(opts.inputFilePath), StandardCharsets.UTF_8);
		} catch (IOException e) {
			logger.severe("unable to read " + opts.inputFilePath + ": " + e.getMessage());
			return EXIT_USAGE;
		}

		logger.info("Parsing and validating " + opts.inputFilePath);
		ValidationResult result = TypeSpecChecker.parseAndValidate(text, opts.policy);
		if (result.isValid()) {
			logger.info("Validated " + result.getDocument().get().getEnvironments().size() + " typing rules");
			return 0;
		}
		for (Diagnostic diagnostic : result.getDiagnostics()) {
			out.println(diagnostic.getMessage());
		}
		if (logger.isLoggable(Level.FINE)) {
			for (Issue issue : result.getIssues()) {
				logger.fine(issue.getMessage());
			}
		}
		return Math.min(result.getDiagnostics().size(), MAX_EXIT_CODE);
	}
}
