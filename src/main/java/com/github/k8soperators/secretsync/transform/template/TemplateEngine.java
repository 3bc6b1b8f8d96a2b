package com.github.k8soperators.secretsync.transform.template;

import com.github.k8soperators.secretsync.SyncException;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Renders templates of the form <code>text {{ pipeline }} text</code>. A
 * pipeline is a chain of commands separated by {@code |}; the value of each
 * command is passed as the last argument of the next one. Missing keys are
 * errors.
 */
public class TemplateEngine {

    private final Map<String, TemplateFunction> functions;

    public TemplateEngine() {
        this(Clock.systemUTC());
    }

    public TemplateEngine(Clock clock) {
        this.functions = TemplateFunctions.defaults(clock);
    }

    /**
     * @param name identifies the template in error messages (usually the target key)
     * @param text the template
     * @param data the value bound to {@code .}
     * @throws SyncException VALIDATION on parse or execution errors
     */
    public String render(String name, String text, Object data) {
        try {
            ParsedTemplate template = TemplateParser.parse(text);
            StringBuilder out = new StringBuilder();

            for (ParsedTemplate.Node node : template.nodes) {
                if (node instanceof ParsedTemplate.Text) {
                    out.append(((ParsedTemplate.Text) node).text);
                } else {
                    out.append(TemplateFunctions.string(pipeline(((ParsedTemplate.Action) node).pipeline, data)));
                }
            }

            return out.toString();
        } catch (TemplateException e) {
            throw new SyncException(SyncException.Kind.VALIDATION, String.format("template %s: %s", name, e.getMessage()), e);
        }
    }

    Object pipeline(ParsedTemplate.Pipeline pipeline, Object dot) {
        Object value = null;
        boolean piped = false;

        for (ParsedTemplate.Command command : pipeline.commands) {
            value = command(command, dot, piped, value);
            piped = true;
        }

        return value;
    }

    Object command(ParsedTemplate.Command command, Object dot, boolean piped, Object input) {
        ParsedTemplate.Operand head = command.operands.get(0);

        if (head instanceof ParsedTemplate.Identifier) {
            String name = ((ParsedTemplate.Identifier) head).name;
            TemplateFunction function = functions.get(name);

            if (function == null) {
                throw new TemplateException("function \"%s\" not defined", name);
            }

            List<Object> args = new ArrayList<>(command.operands.size());

            for (ParsedTemplate.Operand operand : command.operands.subList(1, command.operands.size())) {
                args.add(operand(operand, dot));
            }

            if (piped) {
                args.add(input);
            }

            return function.apply(args);
        }

        if (command.operands.size() > 1 || piped) {
            throw new TemplateException("can't give argument to non-function");
        }

        return operand(head, dot);
    }

    Object operand(ParsedTemplate.Operand operand, Object dot) {
        if (operand instanceof ParsedTemplate.Literal) {
            return ((ParsedTemplate.Literal) operand).value;
        }
        if (operand instanceof ParsedTemplate.Nested) {
            ParsedTemplate.Nested nested = (ParsedTemplate.Nested) operand;
            return walk(pipeline(nested.pipeline, dot), nested.path);
        }
        if (operand instanceof ParsedTemplate.Identifier) {
            return command(new ParsedTemplate.Command(List.of(operand)), dot, false, null);
        }

        return walk(dot, ((ParsedTemplate.Field) operand).path);
    }

    static Object walk(Object start, List<String> path) {
        Object current = start;

        for (String key : path) {
            if (!(current instanceof Map)) {
                throw new TemplateException("can't evaluate field %s", key);
            }

            Map<?, ?> map = (Map<?, ?>) current;

            if (!map.containsKey(key)) {
                throw new TemplateException("map has no entry for key \"%s\"", key);
            }

            current = map.get(key);
        }

        return current;
    }
}
