package typespec.trans.passes.parse.option;

import typespec.TypeSpecOptionException;
import typespec.TypeSpecOptions;

import java.util.logging.ConsoleHandler;
import java.util.logging.Level;
import java.util.logging.Logger;

public class OptionParsingPass {
	private OptionParsingPass() {}

	public static TypeSpecOptions perform(Logger logger, String[] args) throws TypeSpecOptionException {
		TypeSpecOptions opts = new TypeSpecOptions(args);
		// set the logger's log level based on command line arguments
		if (opts.quiet) {
			logger.setLevel(Level.WARNING);
		} else if (opts.verbose) {
			logger.setLevel(Level.FINE);
			// the root console handler drops anything below INFO
			ConsoleHandler handler = new ConsoleHandler();
			handler.setLevel(Level.FINE);
			logger.addHandler(handler);
			logger.setUseParentHandlers(false);
		} else {
			logger.setLevel(Level.INFO);
		}
		opts.parse();
		return opts;
	}
}
