package org.javai.commands.descriptor;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;

/**
 * Utility to convert {@link CommandSignatureVariant} shapes into JSON for usage text or diagnostics.
 */
public final class SignatureVariantJsonMapper {

	private static final ObjectMapper mapper = new ObjectMapper();

	private SignatureVariantJsonMapper() {
	}

	public static ObjectNode toJson(CommandSignatureVariant variant) {
		ObjectNode node = mapper.createObjectNode();
		variant.receiverParameter().ifPresent(receiver -> {
			ObjectNode r = node.putObject("receiver");
			r.put("type", receiver.type().toString());
			r.put("optional", receiver.isOptional());
		});
		ArrayNode params = node.putArray("parameters");
		for (CommandValueParameter parameter : variant.valueParameters()) {
			ObjectNode p = params.addObject();
			if (parameter instanceof CommandValueParameter.StringConstant constant) {
				p.put("kind", "literal");
				p.put("value", constant.expectingValue());
				continue;
			}
			p.put("kind", "value");
			if (parameter.name() != null) {
				p.put("name", parameter.name());
			}
			p.put("type", parameter.matchingType().toString());
			p.put("optional", parameter.isOptional());
			p.put("vararg", parameter.isVararg());
		}
		return node;
	}

	public static ArrayNode toJsonArray(List<? extends CommandSignatureVariant> variants) {
		ArrayNode array = mapper.createArrayNode();
		for (CommandSignatureVariant variant : variants) {
			array.add(toJson(variant));
		}
		return array;
	}
}
