package org.javai.commands.descriptor;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import org.javai.commands.testsupport.TestSenders;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("SignatureVariantJsonMapper")
class SignatureVariantJsonMapperTest {

	@Test
	@DisplayName("describes receiver, literals and typed parameters")
	void describesVariant() {
		CommandSignature signature = CommandSignature.builder()
				.receiver(TestSenders.ConsoleSender.class)
				.literal("kick")
				.required("player", String.class)
				.vararg("reasons", String.class)
				.onCallSync(call -> null)
				.build();

		ObjectNode json = SignatureVariantJsonMapper.toJson(signature);

		assertThat(json.get("receiver").get("type").asText()).isEqualTo("ConsoleSender");
		JsonNode parameters = json.get("parameters");
		assertThat(parameters).hasSize(3);
		assertThat(parameters.get(0).get("kind").asText()).isEqualTo("literal");
		assertThat(parameters.get(0).get("value").asText()).isEqualTo("kick");
		assertThat(parameters.get(1).get("name").asText()).isEqualTo("player");
		assertThat(parameters.get(1).get("type").asText()).isEqualTo("String");
		assertThat(parameters.get(2).get("vararg").asBoolean()).isTrue();
		assertThat(parameters.get(2).get("type").asText()).isEqualTo("String");
	}

	@Test
	@DisplayName("omits the receiver when the variant has none")
	void noReceiver() {
		CommandSignature signature = CommandSignature.builder()
				.optional("page", Integer.class)
				.onCallSync(call -> null)
				.build();

		ObjectNode json = SignatureVariantJsonMapper.toJson(signature);

		assertThat(json.has("receiver")).isFalse();
		assertThat(json.get("parameters").get(0).get("optional").asBoolean()).isTrue();
	}

	@Test
	@DisplayName("maps a list of variants in order")
	void mapsList() {
		CommandSignature first = CommandSignature.builder().literal("a").onCallSync(call -> null).build();
		CommandSignature second = CommandSignature.builder().literal("b").onCallSync(call -> null).build();

		ArrayNode array = SignatureVariantJsonMapper.toJsonArray(List.of(first, second));

		assertThat(array).hasSize(2);
		assertThat(array.get(1).get("parameters").get(0).get("value").asText()).isEqualTo("b");
	}
}
