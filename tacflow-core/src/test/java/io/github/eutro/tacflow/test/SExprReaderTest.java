package io.github.eutro.tacflow.test;

import io.github.eutro.tacflow.core.tree.Point;
import io.github.eutro.tacflow.core.tree.SyntaxNode;
import io.github.eutro.tacflow.core.tree.SyntaxTree;
import io.github.eutro.tacflow.core.tree.sexp.SExprParseException;
import io.github.eutro.tacflow.core.tree.sexp.SExprReader;
import io.github.eutro.tacflow.core.tree.sexp.SExprTree;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

public class SExprReaderTest {
    @Test
    void testLeaf() {
        SExprTree tree = SExprReader.read("(module (identifier \"x\"))");
        SyntaxNode root = tree.getRootNode();
        Assertions.assertEquals("module", root.getType());
        Assertions.assertTrue(root.isNamed());
        Assertions.assertEquals(1, root.getChildren().size());
        SyntaxNode x = root.getChildren().get(0);
        Assertions.assertEquals("identifier", x.getType());
        Assertions.assertTrue(x.getChildren().isEmpty());
        Assertions.assertEquals("x", tree.getSourceText());
        Assertions.assertEquals(0, x.getStartByte());
        Assertions.assertEquals(1, x.getEndByte());
    }

    @Test
    void testFields() {
        SExprTree tree = SExprReader.read(
                "(assignment left: (identifier \"a\") \"=\" right: (integer \"1\"))");
        SyntaxNode root = tree.getRootNode();
        Assertions.assertEquals("a = 1", tree.getSourceText());
        Assertions.assertEquals(3, root.getChildren().size());
        Assertions.assertEquals(2, root.getNamedChildren().size());

        SyntaxNode eq = root.getChildren().get(1);
        Assertions.assertEquals("=", eq.getType());
        Assertions.assertFalse(eq.isNamed());

        SyntaxNode right = root.getChildByFieldName("right");
        Assertions.assertNotNull(right);
        Assertions.assertEquals("integer", right.getType());
        Assertions.assertEquals(4, right.getStartByte());
        Assertions.assertEquals(5, right.getEndByte());
        Assertions.assertEquals(new Point(0, 4), right.getStartPoint());
        Assertions.assertNull(root.getChildByFieldName("value"));
        Assertions.assertEquals(0, root.getStartByte());
        Assertions.assertEquals(5, root.getEndByte());
    }

    @Test
    void testRepeatedField() {
        SyntaxNode root = SExprReader.read("(list element: (a \"1\") element: (b \"2\"))").getRootNode();
        List<SyntaxNode> elements = root.getChildrenByFieldName("element");
        Assertions.assertEquals(2, elements.size());
        Assertions.assertEquals("b", elements.get(1).getType());
        Assertions.assertEquals("a", root.getChildByFieldName("element").getType());
    }

    @Test
    void testCommentsAndLines() {
        SExprTree tree = SExprReader.read("; header\n(module ; first\n (a \"x\")\n (b \"y z\"))\n");
        Assertions.assertEquals("x\ny z", tree.getSourceText());
        SyntaxNode b = tree.getRootNode().getChildren().get(1);
        Assertions.assertEquals(new Point(1, 0), b.getStartPoint());
        Assertions.assertEquals(new Point(1, 3), b.getEndPoint());
    }

    @Test
    void testEscapes() {
        SExprTree tree = SExprReader.read("(string \"say \\\"hi\\\"\")");
        Assertions.assertEquals("say \"hi\"", tree.getSourceText());
    }

    @Test
    void testEmptyNode() {
        SExprTree tree = SExprReader.read("(module)");
        Assertions.assertTrue(tree.getRootNode().getChildren().isEmpty());
        Assertions.assertEquals("", tree.getSourceText());
    }

    @Test
    void testParser() {
        SyntaxTree tree = SExprReader.INSTANCE.parse("(module (a \"x\"))".getBytes(StandardCharsets.UTF_8));
        Assertions.assertArrayEquals("x".getBytes(StandardCharsets.UTF_8), tree.getSource());
    }

    static void assertFails(String text, String message, int offset) {
        SExprParseException e = Assertions.assertThrows(SExprParseException.class, () -> SExprReader.read(text));
        Assertions.assertEquals(message + " at offset " + offset, e.getMessage());
        Assertions.assertEquals(offset, e.getOffset());
    }

    @Test
    void testErrors() {
        assertFails("", "expected '('", 0);
        assertFails("(module", "unclosed node 'module'", 7);
        assertFails("(a) x", "trailing input", 4);
        assertFails("(a \"x)", "unterminated string", 6);
        assertFails("(a b)", "expected ':'", 4);
        assertFails("( )", "expected a word", 2);
    }
}
