package org.pragmatica.plint.document;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;

/// Immutable arena holding every element of one parsed source.
///
/// Elements are addressed by their pre-order index, which is also source order.
/// [DocumentNode] is the [SyntaxNode] view of one slot. A document never changes
/// after construction, so it can be shared between threads freely.
public final class Document {
    private static final int NO_PARENT = -1;

    private final NodeKind[] kinds;
    private final String[] texts;
    private final String[] finishes;
    private final int[] parents;
    private final int[] positionInParent;
    private final int[][] children;
    private final int[] lines;
    private final int[] columns;
    private final boolean complete;

    private Document(int size, boolean complete) {
        this.kinds = new NodeKind[size];
        this.texts = new String[size];
        this.finishes = new String[size];
        this.parents = new int[size];
        this.positionInParent = new int[size];
        this.children = new int[size][];
        this.lines = new int[size];
        this.columns = new int[size];
        this.complete = complete;
    }

    /// Build a document from an element tree.
    public static Document document(ElementSpec root) {
        return document(root, true);
    }

    /// Build a document, recording whether the parser had to close unterminated structures.
    public static Document document(ElementSpec root, boolean complete) {
        var document = new Document(countElements(root), complete);
        new Flattener(document).place(root, NO_PARENT, 0);
        return document;
    }

    private static int countElements(ElementSpec spec) {
        return 1 + spec.children()
                       .stream()
                       .mapToInt(Document::countElements)
                       .sum();
    }

    public SyntaxNode root() {
        return node(0);
    }

    public int size() {
        return kinds.length;
    }

    /// False when the source ended inside an open structure.
    public boolean complete() {
        return complete;
    }

    /// Every statement, nested ones included, in source order.
    public List<SyntaxNode> statements() {
        return IntStream.range(0, size())
                        .filter(index -> kinds[index].isStatement())
                        .mapToObj(this::node)
                        .toList();
    }

    /// Every element of the given kind in source order.
    public List<SyntaxNode> findAll(NodeKind kind) {
        return IntStream.range(0, size())
                        .filter(index -> kinds[index] == kind)
                        .mapToObj(this::node)
                        .toList();
    }

    public String content() {
        return content(0);
    }

    SyntaxNode node(int index) {
        return new DocumentNode(this, index);
    }

    NodeKind kind(int index) {
        return kinds[index];
    }

    int line(int index) {
        return lines[index];
    }

    int column(int index) {
        return columns[index];
    }

    int parent(int index) {
        return parents[index];
    }

    boolean hasParent(int index) {
        return parents[index] != NO_PARENT;
    }

    int[] childIndices(int index) {
        return children[index];
    }

    String content(int index) {
        if (children[index].length == 0) {
            return texts[index] + finishes[index];
        }
        var builder = new StringBuilder();
        appendContent(index, builder);
        return builder.toString();
    }

    private void appendContent(int index, StringBuilder builder) {
        builder.append(texts[index]);
        for (var child : children[index]) {
            appendContent(child, builder);
        }
        builder.append(finishes[index]);
    }

    /// Index of the nearest significant sibling in the given direction, or -1.
    int significantSibling(int index, int direction) {
        if (!hasParent(index)) {
            return -1;
        }
        var siblings = children[parents[index]];
        for (int i = positionInParent[index] + direction; i >= 0 && i < siblings.length; i += direction) {
            if (kinds[siblings[i]].isSignificant()) {
                return siblings[i];
            }
        }
        return -1;
    }

    /// Places elements in pre-order and tracks line and column while walking the text.
    private static final class Flattener {
        private final Document document;
        private int next;
        private int line = 1;
        private int column = 1;

        private Flattener(Document document) {
            this.document = document;
        }

        private int place(ElementSpec spec, int parent, int position) {
            int index = next++;
            document.kinds[index] = spec.kind();
            document.texts[index] = spec.text();
            document.finishes[index] = spec.finish();
            document.parents[index] = parent;
            document.positionInParent[index] = position;
            document.lines[index] = line;
            document.columns[index] = column;
            advance(spec.text());
            var childIndices = new ArrayList<Integer>(spec.children()
                                                          .size());
            var specChildren = spec.children();
            for (int i = 0; i < specChildren.size(); i++) {
                childIndices.add(place(specChildren.get(i), index, i));
            }
            document.children[index] = childIndices.stream()
                                                   .mapToInt(Integer::intValue)
                                                   .toArray();
            advance(spec.finish());
            return index;
        }

        private void advance(String text) {
            for (int i = 0; i < text.length(); i++) {
                if (text.charAt(i) == '\n') {
                    line++;
                    column = 1;
                } else {
                    column++;
                }
            }
        }
    }
}
