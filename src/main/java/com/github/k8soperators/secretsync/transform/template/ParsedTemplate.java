package com.github.k8soperators.secretsync.transform.template;

import java.util.List;

/**
 * Syntax tree of a template: literal text interleaved with actions, each
 * action being a pipeline of commands.
 */
final class ParsedTemplate {

    interface Node {
    }

    interface Operand {
    }

    static final class Text implements Node {
        final String text;

        Text(String text) {
            this.text = text;
        }
    }

    static final class Action implements Node {
        final Pipeline pipeline;

        Action(Pipeline pipeline) {
            this.pipeline = pipeline;
        }
    }

    static final class Pipeline {
        final List<Command> commands;

        Pipeline(List<Command> commands) {
            this.commands = commands;
        }
    }

    static final class Command {
        final List<Operand> operands;

        Command(List<Operand> operands) {
            this.operands = operands;
        }
    }

    /** {@code .} when the path is empty, {@code .a.b} otherwise. */
    static final class Field implements Operand {
        final List<String> path;

        Field(List<String> path) {
            this.path = path;
        }
    }

    static final class Literal implements Operand {
        final Object value;

        Literal(Object value) {
            this.value = value;
        }
    }

    static final class Identifier implements Operand {
        final String name;

        Identifier(String name) {
            this.name = name;
        }
    }

    /** {@code (pipeline)}, optionally followed by a field chain as in {@code (pipeline).a.b}. */
    static final class Nested implements Operand {
        final Pipeline pipeline;
        final List<String> path;

        Nested(Pipeline pipeline, List<String> path) {
            this.pipeline = pipeline;
            this.path = path;
        }
    }

    final List<Node> nodes;

    ParsedTemplate(List<Node> nodes) {
        this.nodes = nodes;
    }
}
