package typespec;

import org.apache.commons.io.FileUtils;
import org.plumelib.options.Option;
import org.plumelib.options.Options;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

public class TypeSpecOptions {
	public static final String VERSION = "0.1.0";

	@Option(value = "Print the version and exit")
	public boolean version = false;

	@Option(value = "-h Print usage information")
	public boolean help = false;

	@Option(value = "-q Reduce printing during execution")
	public boolean quiet = false;

	/**
	 * Be verbose, print extra detailed information. Sets the log level to FINE.
	 */
	@Option(value = "-v Print detailed information during execution")
	public boolean verbose = false;

	@Option(value = "-c path to a JSON configuration file selecting the validation policy, if any")
	public String config;

	@Option(value = "Parse declarations in parallel")
	public boolean parallel = false;

	public String inputFilePath;

	// from the JSON configuration file and --parallel
	public ValidationPolicy policy = ValidationPolicy.defaults();

	private final Options plumeOptions;
	private String[] remainingArgs;

	public void printHelp() {
		plumeOptions.printUsage();
	}

	public TypeSpecOptions(String[] args) throws TypeSpecOptionException {
		plumeOptions = new Options("typespec [options] file", this);
		try {
			remainingArgs = plumeOptions.parse(args);
		} catch (Options.ArgException e) {
			throw new TypeSpecOptionException(e.getMessage());
		}
	}

	/**
	 * @return true if the user asked for help or the version instead of a check
	 */
	public boolean isInformational() {
		return help || version;
	}

	public void parse() throws TypeSpecOptionException {
		if (isInformational()) {
			return;
		}

		if (remainingArgs.length != 1) {
			throw new TypeSpecOptionException("expected exactly one input file, got " + remainingArgs.length);
		}
		inputFilePath = remainingArgs[0];

		if (config != null && !config.isEmpty()) {
			String s;
			try {
				s = FileUtils.readFileToString(new File(config), StandardCharsets.UTF_8);
			} catch (IOException ex) {
				throw new TypeSpecOptionException("Error reading configuration file: " + ex.getMessage());
			}
			try {
				policy = ValidationPolicy.fromJSON(s);
			} catch (TypeSpecOptionException e) {
				throw new TypeSpecOptionException(config + ": " + e.getMsg());
			}
		}
		if (parallel) {
			policy = policy.withParallel(true);
		}
	}
}
