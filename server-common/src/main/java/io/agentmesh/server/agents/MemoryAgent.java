package io.agentmesh.server.agents;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import io.agentmesh.client.mcp.ToolResult;
import io.agentmesh.spec.AgentSkill;
import io.agentmesh.spec.Message;
import org.jspecify.annotations.Nullable;

/**
 * Key/value memory through the {@code memory_store} tool.
 */
public class MemoryAgent implements AgentHandler {

    public static final String NAME = "memory";
    public static final String TOOL = "memory_store";

    public static final String[] KEYWORDS = {
            "store", "save", "remember", "retrieve", "recall", "list", "delete", "remove", "forget", "memory"
    };

    private static final Pattern STORE = Pattern.compile("(?:store|save|remember) (.+) as (.+)");
    private static final Pattern RETRIEVE = Pattern.compile("(?:retrieve|get|recall) (.+)");
    private static final Pattern DELETE = Pattern.compile("(?:delete|remove|forget) (.+)");

    private static final KeywordPredicate STORE_WORDS = new KeywordPredicate("store", "save", "remember");
    private static final KeywordPredicate RETRIEVE_WORDS = new KeywordPredicate("retrieve", "get", "recall");
    private static final KeywordPredicate LIST_WORDS = new KeywordPredicate("list", "show");
    private static final KeywordPredicate DELETE_WORDS = new KeywordPredicate("delete", "remove", "forget");

    public static AgentIdentity identity() {
        return new AgentIdentity(NAME, "Manages memory and data storage for other agents",
                List.of(new AgentSkill("memory", "Memory", "Stores, retrieves, lists and deletes values by key")),
                new MemoryAgent());
    }

    @Override
    public Message handle(Message message, AgentContext context) {
        String text = message.joinedText().toLowerCase(Locale.ROOT);
        String reply;
        if (STORE_WORDS.test(message)) {
            reply = store(text, context);
        } else if (RETRIEVE_WORDS.test(message)) {
            reply = retrieve(text, context);
        } else if (LIST_WORDS.test(message)) {
            reply = list(context);
        } else if (DELETE_WORDS.test(message)) {
            reply = delete(text, context);
        } else {
            reply = "I can help you store, retrieve, list, or delete information."
                    + " Please specify what you'd like me to do.";
        }
        return Message.text(reply);
    }

    private String store(String text, AgentContext context) {
        Matcher matcher = STORE.matcher(text);
        if (!matcher.find()) {
            return "Please use the format: 'store [value] as [key]' or 'save [value] as [key]'";
        }
        String value = matcher.group(1).strip();
        String key = matcher.group(2).strip();
        ToolResult result = context.callTool(TOOL, arguments("store", key, value));
        if (!result.isSuccess()) {
            return ToolReplies.describeFailure(result, "Error storing data", "Error calling memory tool");
        }
        return "Stored '" + value + "' with key '" + key + "'";
    }

    private String retrieve(String text, AgentContext context) {
        Matcher matcher = RETRIEVE.matcher(text);
        if (!matcher.find()) {
            return "Please specify what you'd like to retrieve: 'retrieve [key]' or 'get [key]'";
        }
        String key = matcher.group(1).strip();
        ToolResult result = context.callTool(TOOL, arguments("retrieve", key, null));
        if (!result.isSuccess()) {
            return ToolReplies.describeFailure(result, "Error retrieving data", "Error calling memory tool");
        }
        if (Boolean.TRUE.equals(result.get("found"))) {
            return "Retrieved '" + key + "': " + result.get("value");
        }
        return "No data found for key '" + key + "'";
    }

    private String list(AgentContext context) {
        ToolResult result = context.callTool(TOOL, arguments("list", null, null));
        if (!result.isSuccess()) {
            return ToolReplies.describeFailure(result, "Error listing data", "Error calling memory tool");
        }
        if (result.get("keys") instanceof List<?> keys && !keys.isEmpty()) {
            StringBuilder joined = new StringBuilder();
            for (Object key : keys) {
                if (!joined.isEmpty()) {
                    joined.append(", ");
                }
                joined.append(key);
            }
            return "Stored keys (" + keys.size() + "): " + joined;
        }
        return "No data stored in memory";
    }

    private String delete(String text, AgentContext context) {
        Matcher matcher = DELETE.matcher(text);
        if (!matcher.find()) {
            return "Please specify what you'd like to delete: 'delete [key]' or 'remove [key]'";
        }
        String key = matcher.group(1).strip();
        ToolResult result = context.callTool(TOOL, arguments("delete", key, null));
        if (!result.isSuccess()) {
            return ToolReplies.describeFailure(result, "Error deleting data", "Error calling memory tool");
        }
        if (Boolean.FALSE.equals(result.get("success"))) {
            return "Key '" + key + "' not found";
        }
        return "Deleted key '" + key + "'";
    }

    private static Map<String, Object> arguments(String action, @Nullable String key, @Nullable String value) {
        Map<String, Object> arguments = new LinkedHashMap<>();
        arguments.put("action", action);
        if (key != null) {
            arguments.put("key", key);
        }
        if (value != null) {
            arguments.put("value", value);
        }
        return arguments;
    }
}
