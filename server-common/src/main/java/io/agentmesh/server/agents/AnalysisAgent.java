package io.agentmesh.server.agents;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import io.agentmesh.client.mcp.ToolResult;
import io.agentmesh.spec.AgentSkill;
import io.agentmesh.spec.Message;

/**
 * Weather lookups ({@code weather_info}) and text statistics ({@code text_analyzer}).
 */
public class AnalysisAgent implements AgentHandler {

    public static final String NAME = "analysis";
    public static final String WEATHER_TOOL = "weather_info";
    public static final String TEXT_TOOL = "text_analyzer";

    public static final String[] KEYWORDS = {"weather", "analyze", "analysis"};

    private static final Pattern LOCATION = Pattern.compile("weather (?:in|for|at) (.+)");

    public static AgentIdentity identity() {
        return new AgentIdentity(NAME, "Analyzes text and provides weather information",
                List.of(new AgentSkill("weather", "Weather", "Reports the current weather for a location"),
                        new AgentSkill("analyze", "Text Analysis", "Counts words, sentences and characters")),
                new AnalysisAgent());
    }

    @Override
    public Message handle(Message message, AgentContext context) {
        String text = message.joinedText();
        if (text.toLowerCase(Locale.ROOT).contains("weather")) {
            return Message.text(weather(text, context));
        }
        return Message.text(analyze(text, context));
    }

    private String weather(String text, AgentContext context) {
        Matcher matcher = LOCATION.matcher(text.toLowerCase(Locale.ROOT));
        String location = matcher.find() ? matcher.group(1).strip() : "unknown location";
        ToolResult result = context.callTool(WEATHER_TOOL, Map.of("location", location));
        if (!result.isSuccess()) {
            return ToolReplies.describeFailure(result, "Weather error", "Error getting weather information");
        }
        Object reported = result.get("location");
        return "Weather for " + (reported != null ? reported : location) + ": "
                + result.get("temperature") + ", " + result.get("condition") + ". Humidity: "
                + result.get("humidity") + ", Wind: " + result.get("wind");
    }

    private String analyze(String text, AgentContext context) {
        ToolResult result = context.callTool(TEXT_TOOL, Map.of("text", text));
        if (!result.isSuccess()) {
            return ToolReplies.describeFailure(result, "Analysis error", "Error analyzing text");
        }
        Object average = result.get("average_word_length");
        double averageWordLength = average instanceof Number number ? number.doubleValue() : 0.0;
        return "Text Analysis: " + result.get("word_count") + " words, " + result.get("sentence_count")
                + " sentences, " + result.get("character_count") + " characters. Average word length: "
                + String.format(Locale.ROOT, "%.1f", averageWordLength) + " characters.";
    }
}
