package io.github.eutro.tacflow.core.tree.sexp;

import io.github.eutro.tacflow.core.tree.Point;
import io.github.eutro.tacflow.core.tree.SyntaxTree;
import io.github.eutro.tacflow.core.tree.TreeParser;
import org.jetbrains.annotations.Nullable;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads parse trees written as tree-sitter style S-expressions.
 * <p>
 * The syntax is:
 * <pre>
 * tree  := node
 * node  := '(' type item* ')'
 * item  := [field ':'] (node | string)
 * </pre>
 * A bare string is an unnamed token whose type and text are the string. A node whose only item
 * is an unlabelled string is a named leaf with that text, e.g. {@code (identifier "x")}.
 * A {@code ;} starts a comment running to the end of the line.
 * <p>
 * Source text is synthesized from the leaves, separated by single spaces, with each child of the
 * root on a new line, so that every node has consistent byte offsets and spans.
 */
public class SExprReader implements TreeParser {
    /**
     * An instance of this reader.
     */
    public static final SExprReader INSTANCE = new SExprReader();

    /**
     * Read a tree.
     *
     * @param text The S-expression text.
     * @return The tree.
     * @throws SExprParseException If the text is malformed.
     */
    public static SExprTree read(String text) {
        Parser parser = new Parser(text);
        Raw root = parser.parseNode();
        parser.skipSpace();
        if (parser.pos != text.length()) {
            throw new SExprParseException("trailing input", parser.pos);
        }
        Layout layout = new Layout();
        SExprNode node = layout.lay(root, 0);
        return new SExprTree(node, layout.out.toByteArray());
    }

    @Override
    public SyntaxTree parse(byte[] source) {
        return read(new String(source, StandardCharsets.UTF_8));
    }

    private static class Raw {
        final String type;
        final boolean named;
        @Nullable String leafText;
        final List<String> itemFields = new ArrayList<>();
        final List<Raw> items = new ArrayList<>();

        Raw(String type, boolean named) {
            this.type = type;
            this.named = named;
        }
    }

    private static class Parser {
        final String text;
        int pos;

        Parser(String text) {
            this.text = text;
        }

        void skipSpace() {
            while (pos < text.length()) {
                char c = text.charAt(pos);
                if (c == ';') {
                    while (pos < text.length() && text.charAt(pos) != '\n') pos++;
                } else if (Character.isWhitespace(c)) {
                    pos++;
                } else {
                    break;
                }
            }
        }

        void expect(char c) {
            skipSpace();
            if (pos >= text.length() || text.charAt(pos) != c) {
                throw new SExprParseException(String.format("expected '%c'", c), pos);
            }
            pos++;
        }

        String word() {
            int start = pos;
            while (pos < text.length()) {
                char c = text.charAt(pos);
                if (Character.isWhitespace(c) || c == '(' || c == ')' || c == '"' || c == ':' || c == ';') break;
                pos++;
            }
            if (start == pos) {
                throw new SExprParseException("expected a word", pos);
            }
            return text.substring(start, pos);
        }

        String string() {
            expect('"');
            StringBuilder sb = new StringBuilder();
            while (true) {
                if (pos >= text.length()) {
                    throw new SExprParseException("unterminated string", pos);
                }
                char c = text.charAt(pos++);
                if (c == '"') break;
                if (c == '\\') {
                    if (pos >= text.length()) {
                        throw new SExprParseException("unterminated escape", pos);
                    }
                    char e = text.charAt(pos++);
                    switch (e) {
                        case 'n':
                            sb.append('\n');
                            break;
                        case 't':
                            sb.append('\t');
                            break;
                        default:
                            sb.append(e);
                    }
                } else {
                    sb.append(c);
                }
            }
            return sb.toString();
        }

        Raw parseNode() {
            expect('(');
            skipSpace();
            Raw node = new Raw(word(), true);
            List<String> strings = new ArrayList<>();
            while (true) {
                skipSpace();
                if (pos >= text.length()) {
                    throw new SExprParseException(String.format("unclosed node '%s'", node.type), pos);
                }
                char c = text.charAt(pos);
                if (c == ')') {
                    pos++;
                    break;
                }
                String field = null;
                if (c != '(' && c != '"') {
                    field = word();
                    expect(':');
                    skipSpace();
                    if (pos >= text.length()) {
                        throw new SExprParseException("expected a value after field", pos);
                    }
                    c = text.charAt(pos);
                }
                Raw item;
                if (c == '(') {
                    item = parseNode();
                } else if (c == '"') {
                    String s = string();
                    item = new Raw(s, false);
                    item.leafText = s;
                    if (field == null) strings.add(s);
                } else {
                    throw new SExprParseException("expected a node or a string", pos);
                }
                node.itemFields.add(field);
                node.items.add(item);
            }
            if (node.items.size() == 1 && strings.size() == 1) {
                node.leafText = strings.get(0);
                node.items.clear();
                node.itemFields.clear();
            }
            return node;
        }
    }

    private static class Layout {
        final ByteArrayOutputStream out = new ByteArrayOutputStream();
        int row, column;
        boolean newline;

        SExprNode lay(Raw raw, int depth) {
            SExprNode node = new SExprNode(raw.type, raw.named);
            if (raw.leafText != null) {
                separate();
                node.startByte = out.size();
                node.startPoint = new Point(row, column);
                append(raw.leafText);
            } else {
                int startByte = -1;
                Point startPoint = null;
                for (int i = 0; i < raw.items.size(); i++) {
                    if (depth == 0) newline = true;
                    SExprNode child = lay(raw.items.get(i), depth + 1);
                    if (startPoint == null && child.endByte > child.startByte) {
                        startByte = child.startByte;
                        startPoint = child.startPoint;
                    }
                    node.children.add(child);
                    String field = raw.itemFields.get(i);
                    if (field != null) {
                        node.fields.computeIfAbsent(field, k -> new ArrayList<>()).add(child);
                    }
                }
                if (startPoint == null) {
                    startByte = out.size();
                    startPoint = new Point(row, column);
                }
                node.startByte = startByte;
                node.startPoint = startPoint;
            }
            node.endByte = out.size();
            node.endPoint = new Point(row, column);
            return node;
        }

        void separate() {
            if (out.size() == 0) {
                newline = false;
                return;
            }
            append(newline ? "\n" : " ");
            newline = false;
        }

        void append(String s) {
            byte[] bytes = s.getBytes(StandardCharsets.UTF_8);
            out.write(bytes, 0, bytes.length);
            int lastNl = s.lastIndexOf('\n');
            if (lastNl == -1) {
                column += bytes.length;
            } else {
                for (int i = 0; i < s.length(); i++) {
                    if (s.charAt(i) == '\n') row++;
                }
                column = s.substring(lastNl + 1).getBytes(StandardCharsets.UTF_8).length;
            }
        }
    }
}
