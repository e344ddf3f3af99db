package org.javai.commands.descriptor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import org.javai.commands.parse.CommandCall;
import org.javai.commands.resolve.ResolvedCommandCall;
import org.javai.commands.testsupport.TestSenders;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("CommandSignature")
class CommandSignatureTest {

	@Test
	@DisplayName("builds parameters in declaration order")
	void buildsParameters() {
		CommandSignature signature = CommandSignature.builder()
				.receiver(TestSenders.ConsoleSender.class)
				.literal("set")
				.required("key", String.class)
				.optional("value", Integer.class)
				.onCallSync(call -> null)
				.build();

		assertThat(signature.receiverParameter()).isPresent();
		assertThat(signature.valueParameters()).hasSize(3);
		assertThat(signature.valueParameters().get(0)).isEqualTo(CommandValueParameter.StringConstant.of("set"));
		assertThat(signature.valueParameters().get(2).isOptional()).isTrue();
		assertThat(signature).hasToString(
				"CommandSignatureVariant(<receiver>: ConsoleSender, <set>, key: String, value: Integer? = ...)");
	}

	@Test
	@DisplayName("requires an action")
	void requiresAction() {
		CommandSignature.Builder builder = CommandSignature.builder().literal("noop");

		assertThatThrownBy(builder::build)
				.isInstanceOf(IllegalStateException.class);
	}

	@Test
	@DisplayName("hands out the action's own future")
	void returnsActionFuture() {
		CompletableFuture<String> pending = new CompletableFuture<>();
		CommandSignature signature = CommandSignature.builder()
				.onCall(call -> pending)
				.build();
		ResolvedCommandCall resolved = new ResolvedCommandCall(
				CommandCall.ofTokens(TestSenders.CONSOLE, "noop"), signature, null, List.of());

		CompletableFuture<Object> future = signature.call(resolved);

		assertThat(future).isSameAs(pending);
	}

	@Test
	@DisplayName("reports an action that throws as a failed future")
	void throwingAction() {
		CommandSignature signature = CommandSignature.builder()
				.onCall(call -> {
					throw new IllegalStateException("boom");
				})
				.build();
		ResolvedCommandCall resolved = new ResolvedCommandCall(
				CommandCall.ofTokens(TestSenders.CONSOLE, "noop"), signature, null, List.of());

		CompletableFuture<Object> future = signature.call(resolved);

		assertThat(future).isCompletedExceptionally();
	}
}
