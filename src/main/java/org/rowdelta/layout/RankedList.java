/*
 * Copyright 2026 The RowDelta Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.rowdelta.layout;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered list which also answers the current index of an element it holds,
 * through the node handle returned when the element was inserted. Inserting,
 * removing, indexing and locating all run in expected logarithmic time.
 *
 * <p>Implemented as a treap with implicit keys: nodes are ordered by
 * position, heap ordered by a random priority, and count the nodes beneath
 * them.
 *
 * @author RowDelta Authors
 */
class RankedList<E> {
    /**
     * Handle to an element's place in the list. It stays valid as other
     * elements come and go, until its own element is removed.
     */
    static final class Node<E> {
        E mValue;
        final int mPriority;
        Node<E> mLeft;
        Node<E> mRight;
        Node<E> mParent;
        int mSize;

        Node(E value, int priority) {
            mValue = value;
            mPriority = priority;
            mSize = 1;
        }

        E getValue() {
            return mValue;
        }
    }

    private Node<E> mRoot;
    private int mSeed = 0x2545f491;

    // Outputs of split.
    private Node<E> mSplitLeft;
    private Node<E> mSplitRight;

    RankedList() {
    }

    int size() {
        return size(mRoot);
    }

    /**
     * @throws IndexOutOfBoundsException
     */
    E get(int index) {
        return nodeAt(index).mValue;
    }

    /**
     * @throws IndexOutOfBoundsException
     */
    void set(int index, E value) {
        nodeAt(index).mValue = value;
    }

    /**
     * @throws IndexOutOfBoundsException
     */
    Node<E> nodeAt(int index) {
        checkIndex(index, size() - 1);
        Node<E> node = mRoot;
        while (true) {
            int leftSize = size(node.mLeft);
            if (index < leftSize) {
                node = node.mLeft;
            } else if (index == leftSize) {
                return node;
            } else {
                index -= leftSize + 1;
                node = node.mRight;
            }
        }
    }

    /**
     * Returns the current index of the given node, which must belong to
     * this list.
     */
    int indexOf(Node<E> node) {
        int index = size(node.mLeft);
        while (node.mParent != null) {
            Node<E> parent = node.mParent;
            if (parent.mRight == node) {
                index += size(parent.mLeft) + 1;
            }
            node = parent;
        }
        return index;
    }

    /**
     * Inserts an element, shifting the element at the index and all after it.
     *
     * @return handle to the inserted element
     * @throws IndexOutOfBoundsException if index is negative or greater than size
     */
    Node<E> insert(int index, E value) {
        checkIndex(index, size());
        Node<E> node = new Node<E>(value, nextPriority());
        split(mRoot, index);
        Node<E> left = mSplitLeft;
        Node<E> right = mSplitRight;
        mSplitLeft = mSplitRight = null;
        setRoot(merge(merge(left, node), right));
        return node;
    }

    /**
     * @return the removed element
     * @throws IndexOutOfBoundsException
     */
    E remove(int index) {
        checkIndex(index, size() - 1);
        split(mRoot, index);
        Node<E> left = mSplitLeft;
        split(mSplitRight, 1);
        Node<E> removed = mSplitLeft;
        Node<E> right = mSplitRight;
        mSplitLeft = mSplitRight = null;
        removed.mParent = null;
        setRoot(merge(left, right));
        return removed.mValue;
    }

    /**
     * Returns all elements in order.
     */
    List<E> toList() {
        List<E> list = new ArrayList<E>(size());
        List<Node<E>> stack = new ArrayList<Node<E>>();
        Node<E> node = mRoot;
        while (node != null || !stack.isEmpty()) {
            while (node != null) {
                stack.add(node);
                node = node.mLeft;
            }
            node = stack.remove(stack.size() - 1);
            list.add(node.mValue);
            node = node.mRight;
        }
        return list;
    }

    @Override
    public String toString() {
        return toList().toString();
    }

    /**
     * Splits the tree so that its first count nodes end up in mSplitLeft and
     * the rest in mSplitRight.
     */
    private void split(Node<E> tree, int count) {
        if (tree == null) {
            mSplitLeft = mSplitRight = null;
            return;
        }
        int leftSize = size(tree.mLeft);
        if (count <= leftSize) {
            split(tree.mLeft, count);
            tree.mLeft = mSplitRight;
            update(tree);
            mSplitRight = tree;
        } else {
            split(tree.mRight, count - leftSize - 1);
            tree.mRight = mSplitLeft;
            update(tree);
            mSplitLeft = tree;
        }
        if (mSplitLeft != null) {
            mSplitLeft.mParent = null;
        }
        if (mSplitRight != null) {
            mSplitRight.mParent = null;
        }
    }

    private Node<E> merge(Node<E> left, Node<E> right) {
        if (left == null) {
            return right;
        }
        if (right == null) {
            return left;
        }
        if (left.mPriority > right.mPriority) {
            left.mRight = merge(left.mRight, right);
            update(left);
            return left;
        } else {
            right.mLeft = merge(left, right.mLeft);
            update(right);
            return right;
        }
    }

    private void setRoot(Node<E> root) {
        if (root != null) {
            root.mParent = null;
        }
        mRoot = root;
    }

    private static <E> void update(Node<E> node) {
        node.mSize = 1 + size(node.mLeft) + size(node.mRight);
        if (node.mLeft != null) {
            node.mLeft.mParent = node;
        }
        if (node.mRight != null) {
            node.mRight.mParent = node;
        }
    }

    private static int size(Node<?> node) {
        return node == null ? 0 : node.mSize;
    }

    private int nextPriority() {
        // xorshift
        int x = mSeed;
        x ^= x << 13;
        x ^= x >>> 17;
        x ^= x << 5;
        return mSeed = x;
    }

    private static void checkIndex(int index, int max) {
        if (index < 0 || index > max) {
            throw new IndexOutOfBoundsException("Index: " + index + ", max: " + max);
        }
    }
}
