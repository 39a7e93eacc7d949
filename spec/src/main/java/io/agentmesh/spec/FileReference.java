package io.agentmesh.spec;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

/**
 * Location and description of a file referenced by a {@link FilePart}.
 *
 * @param name the file name, if known
 * @param mimeType the media type, if known
 * @param uri where the file can be fetched from
 */
@JsonInclude(JsonInclude.Include.NON_ABSENT)
@JsonIgnoreProperties(ignoreUnknown = true)
public record FileReference(@JsonProperty("name") @Nullable String name,
                            @JsonProperty("mime_type") @Nullable String mimeType,
                            @JsonProperty("uri") String uri) {

    public FileReference {
        if (uri == null || uri.isBlank()) {
            throw new IllegalArgumentException("File reference requires a uri");
        }
    }
}
