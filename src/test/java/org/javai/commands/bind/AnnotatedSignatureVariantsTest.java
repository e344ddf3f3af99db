package org.javai.commands.bind;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import org.javai.commands.api.CommandParam;
import org.javai.commands.api.SubCommand;
import org.javai.commands.descriptor.BuiltinArgumentParsers;
import org.javai.commands.descriptor.CommandSignatureVariant;
import org.javai.commands.descriptor.CommandValueParameter;
import org.javai.commands.descriptor.TypeDescriptor;
import org.javai.commands.parse.CommandCall;
import org.javai.commands.resolve.DefaultCommandCallResolver;
import org.javai.commands.resolve.ResolutionResult;
import org.javai.commands.testsupport.TestSenders;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link AnnotatedSignatureVariants}.
 */
@DisplayName("AnnotatedSignatureVariants")
class AnnotatedSignatureVariantsTest {

	private CounterCommands commands;
	private List<CommandSignatureVariant> variants;
	private final DefaultCommandCallResolver resolver = new DefaultCommandCallResolver();

	@BeforeEach
	void setUp() {
		commands = new CounterCommands();
		variants = AnnotatedSignatureVariants.fromBean(commands);
	}

	@Nested
	@DisplayName("variant shape")
	class Shape {

		@Test
		@DisplayName("creates one variant per name, ordered by method name")
		void onePerName() {
			// add(2 names), later, page, stop, sum; notACommand is ignored
			assertThat(variants).hasSize(6);
			assertThat(variants)
					.extracting(variant -> ((CommandValueParameter.StringConstant) variant.valueParameters().get(0))
							.expectingValue())
					.containsExactly("add", "plus", "later", "page", "stop", "sum");
		}

		@Test
		@DisplayName("a leading CommandSender parameter becomes the receiver")
		void receiver() {
			CommandSignatureVariant stop = variants.get(4);

			assertThat(stop.receiverParameter()).isPresent();
			assertThat(stop.receiverParameter().get().type())
					.isEqualTo(TypeDescriptor.of(TestSenders.ConsoleSender.class));
			assertThat(stop.valueParameters()).hasSize(1);
		}

		@Test
		@DisplayName("a Java varargs parameter becomes a vararg parameter")
		void vararg() {
			CommandValueParameter values = variants.get(5).valueParameters().get(1);

			assertThat(values.isVararg()).isTrue();
			assertThat(values.matchingType()).isEqualTo(TypeDescriptor.of(Integer.class));
		}

		@Test
		@DisplayName("@CommandParam supplies the name and optionality")
		void commandParam() {
			CommandValueParameter number = variants.get(3).valueParameters().get(1);

			assertThat(number.name()).isEqualTo("number");
			assertThat(number.isOptional()).isTrue();
			assertThat(number.type().nullable()).isTrue();
		}

		@Test
		@DisplayName("a method without names has no leading literal")
		void withoutNames() {
			List<CommandSignatureVariant> nameless = AnnotatedSignatureVariants.fromBean(new EchoCommand());

			assertThat(nameless).hasSize(1);
			assertThat(nameless.get(0).valueParameters())
					.singleElement()
					.isInstanceOf(CommandValueParameter.UserDefinedType.class);
		}
	}

	@Nested
	@DisplayName("invocation")
	class Invocation {

		@Test
		@DisplayName("invokes the method with the converted arguments")
		void invokesMethod() {
			CommandCall call = CommandCall.ofTokens(TestSenders.CONSOLE, "counter", "plus", "5");

			Object returned = resolver.resolve(call, variants, BuiltinArgumentParsers.CONTEXT)
					.orElseThrow()
					.call()
					.join();

			assertThat(returned).isEqualTo(5);
			assertThat(commands.total).isEqualTo(5);
		}

		@Test
		@DisplayName("passes varargs as a primitive array")
		void invokesVarargs() {
			CommandCall call = CommandCall.ofTokens(TestSenders.CONSOLE, "counter", "sum", "1", "2", "3");

			Object returned = resolver.resolve(call, variants, BuiltinArgumentParsers.CONTEXT)
					.orElseThrow()
					.call()
					.join();

			assertThat(returned).isEqualTo(6);
		}

		@Test
		@DisplayName("passes the caller as receiver")
		void invokesWithReceiver() {
			CommandCall call = CommandCall.ofTokens(TestSenders.CONSOLE, "counter", "stop");

			Object returned = resolver.resolve(call, variants, BuiltinArgumentParsers.CONTEXT)
					.orElseThrow()
					.call()
					.join();

			assertThat(returned).isEqualTo("stopped by console");
		}

		@Test
		@DisplayName("rejects a caller of the wrong type")
		void rejectsCaller() {
			CommandCall call = CommandCall.ofTokens(TestSenders.USER, "counter", "stop");

			ResolutionResult result = resolver.resolve(call, variants, BuiltinArgumentParsers.CONTEXT);

			assertThat(result.isSuccess()).isFalse();
		}

		@Test
		@DisplayName("passes null for an omitted optional parameter")
		void omittedOptional() {
			CommandCall call = CommandCall.ofTokens(TestSenders.CONSOLE, "counter", "page");

			Object returned = resolver.resolve(call, variants, BuiltinArgumentParsers.CONTEXT)
					.orElseThrow()
					.call()
					.join();

			assertThat(returned).isEqualTo("page null");
		}

		@Test
		@DisplayName("passes a returned future through")
		void asyncReturn() {
			CommandCall call = CommandCall.ofTokens(TestSenders.CONSOLE, "counter", "later", "hi");

			CompletableFuture<Object> future = resolver.resolve(call, variants, BuiltinArgumentParsers.CONTEXT)
					.orElseThrow()
					.call();

			assertThat(future).isSameAs(commands.later);
		}

		@Test
		@DisplayName("reports an exception thrown by the method as a failed future")
		void methodThrows() {
			CommandCall call = CommandCall.ofTokens(TestSenders.CONSOLE, "counter", "add", "-1");

			CompletableFuture<Object> future = resolver.resolve(call, variants, BuiltinArgumentParsers.CONTEXT)
					.orElseThrow()
					.call();

			assertThat(future).isCompletedExceptionally();
			assertThatThrownBy(future::join)
					.isInstanceOf(CompletionException.class)
					.hasCauseInstanceOf(IllegalArgumentException.class)
					.hasRootCauseMessage("amount must not be negative");
		}
	}

	@Nested
	@DisplayName("invalid declarations")
	class InvalidDeclarations {

		@Test
		@DisplayName("an optional primitive parameter is rejected")
		void optionalPrimitive() {
			assertThatThrownBy(() -> AnnotatedSignatureVariants.fromBean(new OptionalPrimitive()))
					.isInstanceOf(IllegalArgumentException.class)
					.hasMessageContaining("primitive");
		}

		@Test
		@DisplayName("an optional vararg parameter is rejected")
		void optionalVararg() {
			assertThatThrownBy(() -> AnnotatedSignatureVariants.fromBean(new OptionalVararg()))
					.isInstanceOf(IllegalArgumentException.class)
					.hasMessageContaining("cannot be optional");
		}
	}

	public static class CounterCommands {

		int total;
		final CompletableFuture<String> later = new CompletableFuture<>();

		@SubCommand({"add", "plus"})
		public int add(int amount) {
			if (amount < 0) {
				throw new IllegalArgumentException("amount must not be negative");
			}
			total += amount;
			return total;
		}

		@SubCommand("sum")
		public int sum(int... values) {
			int sum = 0;
			for (int value : values) {
				sum += value;
			}
			return sum;
		}

		@SubCommand("stop")
		public String stop(TestSenders.ConsoleSender sender) {
			return "stopped by " + sender.name();
		}

		@SubCommand("page")
		public String page(@CommandParam(name = "number", optional = true) Integer page) {
			return "page " + page;
		}

		@SubCommand("later")
		public CompletableFuture<String> later(String message) {
			return later;
		}

		public void notACommand() {
		}
	}

	public static class EchoCommand {

		@SubCommand
		public String echo(String text) {
			return text;
		}
	}

	public static class OptionalPrimitive {

		@SubCommand("bad")
		public void bad(@CommandParam(optional = true) int count) {
		}
	}

	public static class OptionalVararg {

		@SubCommand("bad")
		public void bad(@CommandParam(optional = true) String... values) {
		}
	}
}
