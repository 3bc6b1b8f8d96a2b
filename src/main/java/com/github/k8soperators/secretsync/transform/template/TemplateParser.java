package com.github.k8soperators.secretsync.transform.template;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Turns template text into a {@link ParsedTemplate}. Actions are delimited by
 * <code>{{ }}</code>; <code>{{- </code> and <code> -}}</code> trim the adjacent
 * whitespace and <code>{{/* ... *&#47;}}</code> is a comment.
 */
final class TemplateParser {

    enum TokenType {
        FIELD,
        CHAIN,
        IDENTIFIER,
        LITERAL,
        PIPE,
        OPEN,
        CLOSE
    }

    static final class Token {
        final TokenType type;
        final String text;
        final Object value;

        Token(TokenType type, String text, Object value) {
            this.type = type;
            this.text = text;
            this.value = value;
        }
    }

    private final List<Token> tokens;
    private int position;

    private TemplateParser(List<Token> tokens) {
        this.tokens = tokens;
    }

    static ParsedTemplate parse(String text) {
        List<ParsedTemplate.Node> nodes = new ArrayList<>();
        int pos = 0;
        boolean trimNext = false;

        while (pos < text.length()) {
            int open = text.indexOf("{{", pos);
            String literal = open < 0 ? text.substring(pos) : text.substring(pos, open);

            if (trimNext) {
                literal = literal.stripLeading();
            }

            if (open < 0) {
                addText(nodes, literal);
                break;
            }

            boolean trimLeft = open + 3 < text.length()
                    && text.charAt(open + 2) == '-'
                    && Character.isWhitespace(text.charAt(open + 3));

            addText(nodes, trimLeft ? literal.stripTrailing() : literal);

            int start = open + (trimLeft ? 3 : 2);
            int close = findClose(text, start);

            if (close < 0) {
                throw new TemplateException("unclosed action at offset %d", open);
            }

            boolean trimRight = close - 2 >= start
                    && text.charAt(close - 1) == '-'
                    && Character.isWhitespace(text.charAt(close - 2));
            String body = text.substring(start, trimRight ? close - 1 : close).trim();

            if (!(body.startsWith("/*") && body.endsWith("*/"))) {
                if (body.isEmpty()) {
                    throw new TemplateException("missing value for command at offset %d", open);
                }
                nodes.add(new ParsedTemplate.Action(new TemplateParser(tokenize(body)).pipelineUntilEnd()));
            }

            pos = close + 2;
            trimNext = trimRight;
        }

        return new ParsedTemplate(nodes);
    }

    static void addText(List<ParsedTemplate.Node> nodes, String text) {
        if (!text.isEmpty()) {
            nodes.add(new ParsedTemplate.Text(text));
        }
    }

    /**
     * Position of the closing braces, skipping over quoted strings.
     */
    static int findClose(String text, int from) {
        char quote = 0;

        for (int i = from; i < text.length(); i++) {
            char c = text.charAt(i);

            if (quote != 0) {
                if (c == '\\' && quote == '"') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
            } else if (c == '"' || c == '`') {
                quote = c;
            } else if (c == '}' && i + 1 < text.length() && text.charAt(i + 1) == '}') {
                return i;
            }
        }

        return -1;
    }

    static List<Token> tokenize(String body) {
        List<Token> result = new ArrayList<>();
        int i = 0;

        while (i < body.length()) {
            char c = body.charAt(i);

            if (Character.isWhitespace(c)) {
                i++;
            } else if (c == '|') {
                result.add(new Token(TokenType.PIPE, "|", null));
                i++;
            } else if (c == '(') {
                result.add(new Token(TokenType.OPEN, "(", null));
                i++;
            } else if (c == ')') {
                result.add(new Token(TokenType.CLOSE, ")", null));
                i++;
            } else if (c == '.') {
                int end = i + 1;
                while (end < body.length() && (isIdentifierPart(body.charAt(end)) || body.charAt(end) == '.')) {
                    end++;
                }
                String field = body.substring(i, end);
                if (field.length() > 1 && (field.endsWith(".") || field.contains(".."))) {
                    throw new TemplateException("bad field %s", field);
                }
                boolean chained = i > 0 && body.charAt(i - 1) == ')';
                if (chained && field.length() == 1) {
                    throw new TemplateException("bad field %s", field);
                }
                result.add(new Token(chained ? TokenType.CHAIN : TokenType.FIELD, field, null));
                i = end;
            } else if (c == '"') {
                StringBuilder value = new StringBuilder();
                int end = i + 1;
                while (end < body.length() && body.charAt(end) != '"') {
                    char next = body.charAt(end);
                    if (next == '\\' && end + 1 < body.length()) {
                        value.append(unescape(body.charAt(++end)));
                    } else {
                        value.append(next);
                    }
                    end++;
                }
                if (end >= body.length()) {
                    throw new TemplateException("unterminated quoted string");
                }
                result.add(new Token(TokenType.LITERAL, body.substring(i, end + 1), value.toString()));
                i = end + 1;
            } else if (c == '`') {
                int end = body.indexOf('`', i + 1);
                if (end < 0) {
                    throw new TemplateException("unterminated raw string");
                }
                result.add(new Token(TokenType.LITERAL, body.substring(i, end + 1), body.substring(i + 1, end)));
                i = end + 1;
            } else if (Character.isDigit(c) || (c == '-' && i + 1 < body.length() && Character.isDigit(body.charAt(i + 1)))) {
                int end = i + 1;
                while (end < body.length() && (Character.isDigit(body.charAt(end)) || body.charAt(end) == '.')) {
                    end++;
                }
                String number = body.substring(i, end);
                result.add(new Token(TokenType.LITERAL, number, parseNumber(number)));
                i = end;
            } else if (isIdentifierStart(c)) {
                int end = i + 1;
                while (end < body.length() && isIdentifierPart(body.charAt(end))) {
                    end++;
                }
                String name = body.substring(i, end);
                result.add(identifier(name));
                i = end;
            } else {
                throw new TemplateException("unexpected %s in command", c);
            }
        }

        return result;
    }

    static Token identifier(String name) {
        switch (name) {
        case "true":
            return new Token(TokenType.LITERAL, name, Boolean.TRUE);
        case "false":
            return new Token(TokenType.LITERAL, name, Boolean.FALSE);
        case "nil":
            return new Token(TokenType.LITERAL, name, null);
        default:
            return new Token(TokenType.IDENTIFIER, name, null);
        }
    }

    static Object parseNumber(String number) {
        try {
            return number.contains(".") ? (Object) Double.valueOf(number) : (Object) Long.valueOf(number);
        } catch (NumberFormatException e) {
            throw new TemplateException("bad number syntax: %s", number);
        }
    }

    static char unescape(char c) {
        switch (c) {
        case 'n':
            return '\n';
        case 't':
            return '\t';
        case 'r':
            return '\r';
        default:
            return c;
        }
    }

    static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    ParsedTemplate.Pipeline pipelineUntilEnd() {
        ParsedTemplate.Pipeline pipeline = pipeline();

        if (position < tokens.size()) {
            throw new TemplateException("unexpected %s in operand", tokens.get(position).text);
        }

        return pipeline;
    }

    ParsedTemplate.Pipeline pipeline() {
        List<ParsedTemplate.Command> commands = new ArrayList<>();
        commands.add(command());

        while (position < tokens.size() && tokens.get(position).type == TokenType.PIPE) {
            position++;
            commands.add(command());
        }

        return new ParsedTemplate.Pipeline(commands);
    }

    ParsedTemplate.Command command() {
        List<ParsedTemplate.Operand> operands = new ArrayList<>();

        while (position < tokens.size()) {
            Token token = tokens.get(position);

            if (token.type == TokenType.PIPE || token.type == TokenType.CLOSE) {
                break;
            }

            position++;

            switch (token.type) {
            case FIELD:
                operands.add(new ParsedTemplate.Field(path(token)));
                break;
            case IDENTIFIER:
                operands.add(new ParsedTemplate.Identifier(token.text));
                break;
            case LITERAL:
                operands.add(new ParsedTemplate.Literal(token.value));
                break;
            case OPEN:
                ParsedTemplate.Pipeline nested = pipeline();
                if (position >= tokens.size() || tokens.get(position).type != TokenType.CLOSE) {
                    throw new TemplateException("unclosed left paren");
                }
                position++;
                List<String> chain = Collections.emptyList();
                if (position < tokens.size() && tokens.get(position).type == TokenType.CHAIN) {
                    chain = path(tokens.get(position++));
                }
                operands.add(new ParsedTemplate.Nested(nested, chain));
                break;
            default:
                throw new TemplateException("unexpected %s in operand", token.text);
            }
        }

        if (operands.isEmpty()) {
            throw new TemplateException("missing value for command");
        }

        return new ParsedTemplate.Command(operands);
    }

    static List<String> path(Token token) {
        return token.text.equals(".")
                ? Collections.emptyList()
                : Arrays.asList(token.text.substring(1).split("\\."));
    }
}
