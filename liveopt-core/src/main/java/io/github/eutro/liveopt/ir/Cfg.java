package io.github.eutro.liveopt.ir;

import io.github.eutro.liveopt.ext.CommonExts;
import io.github.eutro.liveopt.ext.Ext;
import io.github.eutro.liveopt.ext.ExtHolder;
import io.github.eutro.liveopt.ext.MetadataState;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * A control flow graph: a list of {@link BasicBlock basic blocks}, each with a unique index.
 * <p>
 * There is no designated entry block; any block may be the target of no control transfer.
 */
public final class Cfg extends ExtHolder {
    private final List<BasicBlock> blocks = new ArrayList<>();
    private final Map<Integer, BasicBlock> byIndex = new HashMap<>();

    /**
     * Create a new block in this graph, with an {@link Control#end() end} transfer and no instructions.
     *
     * @param index The index of the block.
     * @return The new block.
     * @throws InvalidCfgException If there is already a block with this index.
     */
    public BasicBlock newBlock(int index) {
        if (byIndex.containsKey(index)) {
            throw new InvalidCfgException("duplicate block index " + index);
        }
        BasicBlock bb = new BasicBlock(this, index);
        blocks.add(bb);
        byIndex.put(index, bb);
        metaState.graphChanged();
        return bb;
    }

    /**
     * Get the blocks of this graph, in the order they were created.
     *
     * @return An unmodifiable view of the blocks.
     */
    public List<BasicBlock> getBlocks() {
        return Collections.unmodifiableList(blocks);
    }

    /**
     * Look up a block by index.
     *
     * @param index The index.
     * @return The block, or null if there is none with that index.
     */
    public @Nullable BasicBlock findBlock(int index) {
        return byIndex.get(index);
    }

    /**
     * Look up a block by index.
     *
     * @param index The index.
     * @return The block.
     * @throws InvalidCfgException If there is no block with that index.
     */
    public BasicBlock getBlock(int index) {
        BasicBlock bb = byIndex.get(index);
        if (bb == null) {
            throw new InvalidCfgException("no block with index " + index);
        }
        return bb;
    }

    /**
     * Resolve the successors of a block of this graph.
     *
     * @param block The block.
     * @return The successor blocks, in the order of {@link Control#targets()}.
     * @throws InvalidCfgException If a target names no block.
     */
    public List<BasicBlock> successors(BasicBlock block) {
        List<Integer> targets = block.getNext().targets();
        List<BasicBlock> succs = new ArrayList<>(targets.size());
        for (int target : targets) {
            BasicBlock succ = byIndex.get(target);
            if (succ == null) {
                throw new InvalidCfgException(String.format(
                        "control transfer references block not in graph;" +
                                "\n  referenced: %d" +
                                "\n  control: %s" +
                                "\n  in block: %s",
                        target,
                        block.getNext(),
                        block.toTargetString()));
            }
            succs.add(succ);
        }
        return succs;
    }

    /**
     * Count the instructions in every block of this graph.
     *
     * @return The total number of instructions.
     */
    public int insnCount() {
        int count = 0;
        for (BasicBlock block : blocks) {
            count += block.getInsns().size();
        }
        return count;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("cfg {\n");
        for (BasicBlock block : blocks) {
            sb.append(block).append('\n');
        }
        sb.append("}");
        return sb.toString();
    }

    // exts
    private MetadataState metaState = new MetadataState();

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.METADATA_STATE) {
            metaState = (MetadataState) Objects.requireNonNull(value);
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.METADATA_STATE) {
            throw new UnsupportedOperationException("a cfg always has a metadata state");
        }
        super.removeExt(ext);
    }

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.METADATA_STATE) {
            return (T) metaState;
        }
        return super.getNullable(ext);
    }
}
