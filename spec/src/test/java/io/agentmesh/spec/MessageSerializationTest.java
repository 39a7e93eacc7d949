package io.agentmesh.spec;

import static io.agentmesh.util.Utils.OBJECT_MAPPER;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

public class MessageSerializationTest {

    @Test
    public void testDeserializeTextPartWireFormat() throws Exception {
        String json = """
            {"parts":[{"type":"text","content":"Hello"}]}
            """;

        Message message = OBJECT_MAPPER.readValue(json, Message.class);

        assertEquals(1, message.parts().size());
        TextPart part = assertInstanceOf(TextPart.class, message.parts().get(0));
        assertEquals("Hello", part.content());
        assertNull(message.taskId());
    }

    @Test
    public void testDeserializeMixedParts() throws Exception {
        String json = """
            {
              "task_id": "task-1",
              "parts": [
                {"type": "text", "content": "see attached"},
                {"type": "data", "content": {"count": 3}},
                {"type": "file", "content": {"name": "a.txt", "mime_type": "text/plain", "uri": "file:///tmp/a.txt"}}
              ]
            }
            """;

        Message message = OBJECT_MAPPER.readValue(json, Message.class);

        assertEquals("task-1", message.taskId());
        assertEquals(Part.Kind.TEXT, message.parts().get(0).type());
        DataPart data = assertInstanceOf(DataPart.class, message.parts().get(1));
        assertEquals(3, data.content().get("count"));
        FilePart file = assertInstanceOf(FilePart.class, message.parts().get(2));
        assertEquals("text/plain", file.content().mimeType());
        assertEquals("see attached", message.joinedText());
    }

    @Test
    public void testSerializeUsesTypeDiscriminator() throws Exception {
        Message message = Message.builder()
                .text("Echo: Hello")
                .addPart(new DataPart(Map.of("k", "v")))
                .build();

        JsonNode node = OBJECT_MAPPER.readTree(OBJECT_MAPPER.writeValueAsString(message));

        assertEquals("text", node.get("parts").get(0).get("type").asText());
        assertEquals("Echo: Hello", node.get("parts").get(0).get("content").asText());
        assertEquals("data", node.get("parts").get(1).get("type").asText());
        assertEquals("v", node.get("parts").get(1).get("content").get("k").asText());
    }

    @Test
    public void testUnknownPartTypeIsRejected() {
        String json = """
            {"parts":[{"type":"video","content":"x"}]}
            """;

        assertThrows(Exception.class, () -> OBJECT_MAPPER.readValue(json, Message.class));
    }

    @Test
    public void testMessageIsImmutable() {
        List<Part<?>> parts = new java.util.ArrayList<>();
        parts.add(new TextPart("a"));
        Message message = new Message(parts);

        parts.add(new TextPart("b"));

        assertEquals(1, message.parts().size());
        assertThrows(UnsupportedOperationException.class, () -> message.parts().add(new TextPart("c")));
    }

    @Test
    public void testJoinedTextSkipsNonTextParts() {
        Message message = Message.builder()
                .text("add")
                .addPart(new DataPart(Map.of("a", 1)))
                .text("2 and 3")
                .build();

        assertEquals("add 2 and 3", message.joinedText());
    }
}
