package org.javai.commands.internal.resolve;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;

import java.time.Duration;
import org.javai.commands.descriptor.ArgumentAcceptance;
import org.javai.commands.descriptor.BuiltinArgumentParsers;
import org.javai.commands.descriptor.CommandArgumentContext;
import org.javai.commands.descriptor.CommandValueArgumentParser;
import org.javai.commands.descriptor.CommandValueParameter.StringConstant;
import org.javai.commands.descriptor.CommandValueParameter.UserDefinedType;
import org.javai.commands.descriptor.TypeHierarchy;
import org.javai.commands.parse.CommandValueArgument;
import org.javai.commands.parse.TypeVariant;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ArgumentMatcher")
class ArgumentMatcherTest {

	private final ArgumentMatcher builtins = new ArgumentMatcher(BuiltinArgumentParsers.CONTEXT, TypeHierarchy.classBased());

	@Nested
	@DisplayName("typed parameters")
	class TypedParameters {

		@Test
		@DisplayName("an argument whose type fits is Direct whatever the context holds")
		void directRegardlessOfContext() {
			UserDefinedType parameter = UserDefinedType.createRequired("n", Number.class);
			CommandValueArgument argument = CommandValueArgument.of(5);

			assertThat(builtins.accepting(parameter, argument)).isEqualTo(ArgumentAcceptance.DIRECT);
			assertThat(new ArgumentMatcher(CommandArgumentContext.EMPTY, TypeHierarchy.classBased())
					.accepting(parameter, argument)).isEqualTo(ArgumentAcceptance.DIRECT);
		}

		@Test
		@DisplayName("a raw token fits a String parameter directly")
		void tokenFitsString() {
			UserDefinedType parameter = UserDefinedType.createRequired("s", String.class);

			assertThat(builtins.accepting(parameter, CommandValueArgument.ofToken("bar")))
					.isEqualTo(ArgumentAcceptance.DIRECT);
		}

		@Test
		@DisplayName("the first fitting offered type variant wins over the context")
		void firstOfferedVariantWins() {
			TypeVariant<Long> asLong = TypeVariant.of(Long.class, arg -> 1L);
			TypeVariant<Integer> first = TypeVariant.of(Integer.class, arg -> 1);
			TypeVariant<Integer> second = TypeVariant.of(Integer.class, arg -> 2);
			CommandValueArgument argument = CommandValueArgument.of("one", "one", asLong, first, second);

			ArgumentAcceptance acceptance = builtins.accepting(UserDefinedType.createRequired("n", Integer.class), argument);

			assertThat(acceptance).isEqualTo(new ArgumentAcceptance.WithTypeConversion(first));
			assertThat(acceptance.acceptanceLevel()).isEqualTo(ArgumentAcceptance.TYPE_CONVERSION_LEVEL);
		}

		@Test
		@DisplayName("falls back to the context parser for the expected type")
		void contextual() {
			ArgumentAcceptance acceptance = builtins.accepting(
					UserDefinedType.createRequired("n", int.class), CommandValueArgument.ofToken("5"));

			assertThat(acceptance).isEqualTo(new ArgumentAcceptance.WithContextualConversion(BuiltinArgumentParsers.INT));
			assertThat(acceptance.acceptanceLevel()).isEqualTo(ArgumentAcceptance.CONTEXTUAL_CONVERSION_LEVEL);
		}

		@Test
		@DisplayName("is Impossible without a fitting type, variant or parser")
		void impossible() {
			ArgumentAcceptance acceptance = builtins.accepting(
					UserDefinedType.createRequired("when", Duration.class), CommandValueArgument.ofToken("5s"));

			assertThat(acceptance).isEqualTo(ArgumentAcceptance.IMPOSSIBLE);
			assertThat(acceptance.isAcceptable()).isFalse();
		}

		@Test
		@DisplayName("a vararg parameter is matched against its element type")
		void varargElementType() {
			UserDefinedType parameter = UserDefinedType.createVararg("ns", Integer.class);

			assertThat(builtins.accepting(parameter, CommandValueArgument.of(3))).isEqualTo(ArgumentAcceptance.DIRECT);
			assertThat(builtins.accepting(parameter, CommandValueArgument.ofToken("3")))
					.isInstanceOf(ArgumentAcceptance.WithContextualConversion.class);
		}

		@Test
		@DisplayName("never invokes the parser it selects")
		@SuppressWarnings("unchecked")
		void doesNotInvokeParser() {
			CommandValueArgumentParser<Integer> parser = mock(CommandValueArgumentParser.class);
			ArgumentMatcher matcher = new ArgumentMatcher(
					CommandArgumentContext.builder().add(Integer.class, parser).build(), TypeHierarchy.classBased());

			matcher.accepting(UserDefinedType.createRequired("n", Integer.class), CommandValueArgument.ofToken("5"));

			verifyNoInteractions(parser);
		}
	}

	@Nested
	@DisplayName("literal parameters")
	class LiteralParameters {

		private final StringConstant add = StringConstant.of("add");

		@Test
		@DisplayName("accept only the exact token")
		void exactToken() {
			assertThat(builtins.accepting(add, CommandValueArgument.ofToken("add"))).isEqualTo(ArgumentAcceptance.DIRECT);
			assertThat(builtins.accepting(add, CommandValueArgument.ofToken("Add"))).isEqualTo(ArgumentAcceptance.IMPOSSIBLE);
			assertThat(builtins.accepting(add, CommandValueArgument.ofToken("add "))).isEqualTo(ArgumentAcceptance.IMPOSSIBLE);
		}

		@Test
		@DisplayName("reject an argument without a raw token even if its value matches")
		void requiresRawToken() {
			assertThat(builtins.accepting(add, CommandValueArgument.of("add"))).isEqualTo(ArgumentAcceptance.IMPOSSIBLE);
		}
	}
}
