package io.agentmesh.server.agents;

import java.util.ArrayList;
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
 * Arithmetic through the {@code calculator} tool.
 */
public class CalculatorAgent implements AgentHandler {

    public static final String NAME = "calculator";
    public static final String TOOL = "calculator";

    public static final String[] KEYWORDS = {
            "add", "subtract", "multiply", "divide", "calculate", "math", "square", "sqrt", "+", "-", "*", "/"
    };

    private static final Pattern NUMBER = Pattern.compile("-?\\d+\\.?\\d*");
    private static final Pattern EXPRESSION = Pattern.compile(
            "(-?\\d+(?:\\.\\d+)?)\\s*([+\\-*/])\\s*(-?\\d+(?:\\.\\d+)?)");

    public static AgentIdentity identity() {
        return new AgentIdentity(NAME, "Performs mathematical calculations and data analysis",
                List.of(new AgentSkill("calculate", "Calculator",
                        "Adds, subtracts, multiplies and divides numbers, squares them and takes square roots")),
                new CalculatorAgent());
    }

    @Override
    public Message handle(Message message, AgentContext context) {
        return Message.text(reply(message.joinedText(), context));
    }

    private String reply(String text, AgentContext context) {
        String lower = text.toLowerCase(Locale.ROOT);
        Matcher expression = EXPRESSION.matcher(text);
        if (lower.contains("add")) {
            return arithmetic(text, "add", context);
        } else if (lower.contains("subtract")) {
            return arithmetic(text, "subtract", context);
        } else if (lower.contains("multiply") || lower.contains("times")) {
            return arithmetic(text, "multiply", context);
        } else if (lower.contains("divide")) {
            return arithmetic(text, "divide", context);
        } else if (lower.contains("square root") || lower.contains("sqrt")) {
            return unary(text, "sqrt", context);
        } else if (lower.contains("square")) {
            return unary(text, "square", context);
        } else if (expression.find()) {
            String operation = switch (expression.group(2)) {
                case "+" -> "add";
                case "-" -> "subtract";
                case "*" -> "multiply";
                default -> "divide";
            };
            return calculate(operation, Double.parseDouble(expression.group(1)),
                    Double.parseDouble(expression.group(3)), context);
        }
        List<String> numbers = numbers(text);
        if (numbers.size() >= 2) {
            return "I found numbers " + numbers + " in your message. Please specify what operation you'd like me"
                    + " to perform (add, subtract, multiply, divide).";
        } else if (numbers.size() == 1) {
            return "I found the number " + numbers.get(0) + ". I can square it, find its square root,"
                    + " or perform operations with another number.";
        }
        return "I'm a calculator agent. I can help you with mathematical operations like addition, subtraction,"
                + " multiplication, division, squares, and square roots. Please provide numbers and specify"
                + " the operation.";
    }

    private String arithmetic(String text, String operation, AgentContext context) {
        List<String> numbers = numbers(text);
        if (numbers.size() < 2) {
            return "I need two numbers to perform " + operation + ". Please provide both numbers.";
        }
        return calculate(operation, Double.parseDouble(numbers.get(0)), Double.parseDouble(numbers.get(1)), context);
    }

    private String unary(String text, String operation, AgentContext context) {
        List<String> numbers = numbers(text);
        if (numbers.isEmpty()) {
            return "sqrt".equals(operation) ? "I need a number to find its square root." : "I need a number to square it.";
        }
        double a = Double.parseDouble(numbers.get(0));
        ToolResult result = context.callTool(TOOL, arguments(operation, a, null));
        if (!result.isSuccess()) {
            return ToolReplies.describeFailure(result, "Calculation error", "Error calling calculator tool");
        }
        String value = ToolReplies.format(result.get("result"));
        return "sqrt".equals(operation) ? "Square root of " + a + " = " + value : a + " squared = " + value;
    }

    private String calculate(String operation, double a, double b, AgentContext context) {
        ToolResult result = context.callTool(TOOL, arguments(operation, a, b));
        if (!result.isSuccess()) {
            return ToolReplies.describeFailure(result, "Calculation error", "Error calling calculator tool");
        }
        return "Calculation: " + a + " " + operation + " " + b + " = " + ToolReplies.format(result.get("result"));
    }

    private static Map<String, Object> arguments(String operation, double a, @Nullable Double b) {
        Map<String, Object> arguments = new LinkedHashMap<>();
        arguments.put("operation", operation);
        arguments.put("a", a);
        if (b != null) {
            arguments.put("b", b);
        }
        return arguments;
    }

    private static List<String> numbers(String text) {
        List<String> numbers = new ArrayList<>();
        Matcher matcher = NUMBER.matcher(text);
        while (matcher.find()) {
            numbers.add(matcher.group());
        }
        return numbers;
    }
}
