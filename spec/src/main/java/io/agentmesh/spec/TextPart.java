package io.agentmesh.spec;

import static io.agentmesh.spec.TextPart.TEXT;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeName;
import io.agentmesh.util.Assert;
import org.jspecify.annotations.Nullable;

/**
 * Plain text content part, the most common part type.
 * <p>
 * Example usage:
 * <pre>{@code
 * TextPart greeting = new TextPart("Hello, how can I help you?");
 * TextPart withMetadata = new TextPart("Bonjour!", Map.of("language", "fr"));
 * }</pre>
 *
 * @see Part
 * @see Message
 */
@JsonTypeName(TEXT)
@JsonInclude(JsonInclude.Include.NON_ABSENT)
@JsonIgnoreProperties(ignoreUnknown = true)
public record TextPart(@JsonProperty("content") String content,
                       @JsonProperty("metadata") @Nullable Map<String, Object> metadata) implements Part<String> {

    public static final String TEXT = "text";

    @JsonCreator
    public TextPart {
        Assert.checkNotNullParam("content", content);
        metadata = (metadata != null) ? Map.copyOf(metadata) : null;
    }

    public TextPart(String content) {
        this(content, null);
    }

    @Override
    @JsonProperty("type")
    public Kind type() {
        return Kind.TEXT;
    }
}
