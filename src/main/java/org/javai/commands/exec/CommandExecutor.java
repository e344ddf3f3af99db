package org.javai.commands.exec;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicReference;
import org.javai.commands.descriptor.BuiltinArgumentParsers;
import org.javai.commands.descriptor.CommandArgumentContext;
import org.javai.commands.descriptor.CommandSignatureVariant;
import org.javai.commands.parse.CommandCall;
import org.javai.commands.resolve.CommandCallResolver;
import org.javai.commands.resolve.DefaultCommandCallResolver;
import org.javai.commands.resolve.ResolutionResult;
import org.javai.commands.resolve.ResolvedCommandCall;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves a call and runs the selected variant's action.
 * <p>
 * Resolution runs on the configured {@link Executor} (the calling thread by default);
 * the action's own future is then composed into the returned one. Cancelling the
 * returned future cancels the action's future if it has already started, and keeps
 * it from starting otherwise. Failures are reported as results, never retried.
 *
 * <pre>{@code
 * CommandExecutor executor = CommandExecutor.builder()
 *         .context(BuiltinArgumentParsers.CONTEXT.plus(customParsers))
 *         .executor(commandPool)
 *         .build();
 * executor.execute(call, variantsOf(call.calleeName()))
 *         .thenAccept(result -> report(result));
 * }</pre>
 */
public final class CommandExecutor {

	private static final Logger logger = LoggerFactory.getLogger(CommandExecutor.class);

	private final CommandCallResolver resolver;
	private final CommandArgumentContext context;
	private final Executor executor;

	private CommandExecutor(CommandCallResolver resolver, CommandArgumentContext context, Executor executor) {
		this.resolver = resolver;
		this.context = context;
		this.executor = executor;
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Resolves {@code call} against {@code variants} and runs the winner.
	 *
	 * @return a future completing with the outcome; it completes exceptionally only if the
	 * resolver itself throws or the executor rejects the task
	 */
	public CompletableFuture<CommandExecuteResult> execute(CommandCall call,
			List<? extends CommandSignatureVariant> variants) {
		Objects.requireNonNull(call, "call must not be null");
		Objects.requireNonNull(variants, "variants must not be null");

		CompletableFuture<CommandExecuteResult> result = new CompletableFuture<>();
		AtomicReference<CompletableFuture<Object>> inFlight = new AtomicReference<>();
		result.whenComplete((ignored, error) -> {
			if (result.isCancelled()) {
				CompletableFuture<Object> action = inFlight.get();
				if (action != null) {
					action.cancel(true);
				}
			}
		});

		try {
			executor.execute(() -> run(call, variants, result, inFlight));
		}
		catch (RejectedExecutionException ex) {
			result.completeExceptionally(ex);
		}
		return result;
	}

	private void run(CommandCall call, List<? extends CommandSignatureVariant> variants,
			CompletableFuture<CommandExecuteResult> result, AtomicReference<CompletableFuture<Object>> inFlight) {
		if (result.isDone()) {
			return;
		}

		ResolutionResult resolution;
		try {
			resolution = resolver.resolve(call, variants, context);
		}
		catch (RuntimeException ex) {
			result.completeExceptionally(ex);
			return;
		}

		if (resolution instanceof ResolutionResult.Failure failure) {
			logger.debug("Call to '{}' not executed: {}", call.calleeName(), failure.reason().message());
			result.complete(new CommandExecuteResult.ResolutionFailed(call, failure.reason()));
			return;
		}

		ResolvedCommandCall resolved = resolution.orElseThrow();
		CompletableFuture<Object> action;
		try {
			action = resolved.call();
		}
		catch (RuntimeException ex) {
			fail(result, resolved, ex);
			return;
		}
		if (action == null) {
			fail(result, resolved, new IllegalStateException("Variant " + resolved.variant() + " returned no future"));
			return;
		}
		inFlight.set(action);
		if (result.isCancelled()) {
			action.cancel(true);
			return;
		}

		action.whenComplete((returnValue, error) -> {
			if (error == null) {
				result.complete(new CommandExecuteResult.Success(resolved, returnValue));
				return;
			}
			fail(result, resolved, unwrap(error));
		});
	}

	private static void fail(CompletableFuture<CommandExecuteResult> result, ResolvedCommandCall resolved,
			Throwable cause) {
		logger.warn("Command '{}' failed with {}: {}", resolved.calleeName(), resolved.variant(), cause.toString(),
				cause);
		result.complete(new CommandExecuteResult.ExecutionFailed(resolved, cause));
	}

	private static Throwable unwrap(Throwable error) {
		Throwable current = error;
		while ((current instanceof CompletionException || current instanceof ExecutionException)
				&& current.getCause() != null) {
			current = current.getCause();
		}
		return current;
	}

	/**
	 * Builder for {@link CommandExecutor}.
	 */
	public static final class Builder {

		private CommandCallResolver resolver = new DefaultCommandCallResolver();
		private CommandArgumentContext context = BuiltinArgumentParsers.CONTEXT;
		private Executor executor = Runnable::run;

		private Builder() {
		}

		public Builder resolver(CommandCallResolver resolver) {
			this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
			return this;
		}

		public Builder context(CommandArgumentContext context) {
			this.context = Objects.requireNonNull(context, "context must not be null");
			return this;
		}

		public Builder executor(Executor executor) {
			this.executor = Objects.requireNonNull(executor, "executor must not be null");
			return this;
		}

		public CommandExecutor build() {
			return new CommandExecutor(resolver, context, executor);
		}
	}
}
