package com.earnix.parquet.inspector.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.UncheckedIOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.NoSuchFileException;

/**
 * Prints {@code Error: <message>} for a failed command and exits with status 1
 */
class ErrorMessageHandler implements CommandLine.IExecutionExceptionHandler
{
	private static final Logger LOG = LoggerFactory.getLogger(ErrorMessageHandler.class);

	static final int EXIT_FAILURE = 1;

	@Override
	public int handleExecutionException(Exception ex, CommandLine commandLine, CommandLine.ParseResult parseResult)
	{
		LOG.debug("Command {} failed", commandLine.getCommandName(), ex);
		commandLine.getErr().println("Error: " + message(ex));
		commandLine.getErr().flush();
		return EXIT_FAILURE;
	}

	static String message(Throwable ex)
	{
		if (ex instanceof UncheckedIOException && ex.getCause() != null)
			return message(ex.getCause());
		if (ex instanceof NoSuchFileException)
			return "No such file or directory: " + ex.getMessage();
		if (ex instanceof AccessDeniedException)
			return "Permission denied: " + ex.getMessage();
		if (ex.getMessage() == null)
			return ex.getClass().getSimpleName();
		return ex.getMessage();
	}
}
