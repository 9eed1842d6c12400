package im.arun.htmldiff.tree;

/**
 * Positional node ids, one counter per node kind ({@code block-N}, {@code li-N}).
 * A fresh sequence is used for every parse or diff so ids are unique within one tree.
 */
final class NodeIdSequence {
    private int blockIndex;
    private int itemIndex;

    String nextBlockId() {
        return "block-" + blockIndex++;
    }

    String nextItemId() {
        return "li-" + itemIndex++;
    }

    /**
     * Give back the last item id when that item produced no node. Only valid while no
     * other id has been taken since.
     */
    void releaseItemId() {
        itemIndex--;
    }
}
