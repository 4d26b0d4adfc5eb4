package com.etcd.coordination.store;

/**
 * Options for {@link ValueStore#read}.
 *
 * @param recursive read the whole subtree rooted at the key as a nested object
 */
public record ReadOptions(boolean recursive) {

    private static final ReadOptions SINGLE = new ReadOptions(false);
    private static final ReadOptions TREE = new ReadOptions(true);

    public static ReadOptions single() {
        return SINGLE;
    }

    public static ReadOptions tree() {
        return TREE;
    }
}
