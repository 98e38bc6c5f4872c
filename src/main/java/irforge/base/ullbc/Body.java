package irforge.base.ullbc;

import irforge.base.expressions.Locals;
import irforge.base.meta.SourceComment;
import irforge.base.meta.Span;
import irforge.base.types.TypeFolder;
import irforge.base.types.TypeVisitor;
import irforge.errors.TranslationError;

import java.util.ArrayList;
import java.util.ArrayDeque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * An unstructured body: a graph of basic blocks. Block 0 is the entry.
 * Blocks are removed in place by the micro-passes; the id of a removed block is never handed out
 * again.
 */
public class Body {
    public static final int ENTRY = 0;

    public final Span span;
    public final Locals locals;
    public final TreeMap<Integer, BlockData> blocks = new TreeMap<>();
    public final List<SourceComment> comments = new ArrayList<>();
    private int nextBlockId = 0;

    public Body(Span span, Locals locals) {
        this.span = span == null ? Span.DUMMY : span;
        this.locals = locals;
    }

    /** Allocate a fresh block id without inserting a block. */
    public int reserveBlockId() {
        return nextBlockId++;
    }

    public int newBlock(BlockData block) {
        int id = nextBlockId++;
        blocks.put(id, block);
        return id;
    }

    /** Fill a block whose id was handed out by {@link #reserveBlockId()}. */
    public void setBlock(int id, BlockData block) {
        if (id >= nextBlockId) {
            throw TranslationError.malformedGraph(String.format("Block id bb%d was never allocated", id));
        }
        if (blocks.putIfAbsent(id, block) != null) {
            throw TranslationError.malformedGraph(String.format("Duplicate block id bb%d", id));
        }
    }

    public BlockData block(int id) {
        BlockData block = blocks.get(id);
        if (block == null) {
            throw TranslationError.malformedGraph(String.format("Dangling block reference bb%d", id));
        }
        return block;
    }

    public int nextBlockId() {
        return nextBlockId;
    }

    /**
     * Check the structural invariants: the entry exists and every terminator targets an existing
     * block.
     * @throws TranslationError of kind MALFORMED_GRAPH
     */
    public void validate() {
        if (!blocks.containsKey(ENTRY)) {
            throw TranslationError.malformedGraph("Body has no entry block");
        }
        for (Map.Entry<Integer, BlockData> entry : blocks.entrySet()) {
            for (int target : entry.getValue().terminator.targets()) {
                if (!blocks.containsKey(target)) {
                    throw TranslationError.malformedGraph(String.format(
                            "Terminator of bb%d targets missing block bb%d", entry.getKey(), target));
                }
            }
        }
    }

    /** Blocks reachable from the entry, in depth-first discovery order. */
    public Set<Integer> reachableBlocks() {
        Set<Integer> seen = new HashSet<>();
        ArrayDeque<Integer> stack = new ArrayDeque<>();
        stack.push(ENTRY);
        while (!stack.isEmpty()) {
            int id = stack.pop();
            if (!seen.add(id)) {
                continue;
            }
            for (int target : block(id).terminator.targets()) {
                if (!seen.contains(target)) {
                    stack.push(target);
                }
            }
        }
        return seen;
    }

    /** Drop every block that cannot be reached from the entry. */
    public int removeUnreachableBlocks() {
        Set<Integer> reachable = reachableBlocks();
        int before = blocks.size();
        blocks.keySet().retainAll(reachable);
        return before - blocks.size();
    }

    public void foldTypes(TypeFolder folder) {
        locals.foldTypes(folder);
        for (BlockData block : blocks.values()) {
            block.statements.replaceAll(s -> s.foldTypes(folder));
            block.terminator = block.terminator.foldTypes(folder);
        }
    }

    public void visitTypes(TypeVisitor visitor) {
        locals.visitTypes(visitor);
        for (BlockData block : blocks.values()) {
            block.statements.forEach(s -> s.visitTypes(visitor));
            block.terminator.visitTypes(visitor);
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        blocks.forEach((id, block) -> sb.append("bb").append(id).append(": {\n").append(block).append("\n}\n"));
        return sb.toString();
    }
}
