package com.tandemsystems.queue;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Singly linked LIFO stack. All operations are O(1) except {@link #toList()}.
 *
 * Not thread-safe; owned by the queue that embeds it.
 *
 * @param <T> The type of items
 */
public class LinkedStack<T> {

    private Node<T> head;
    private int size;

    /**
     * Pushes an item on top of the stack.
     *
     * @param item the item, not null
     */
    public void push(T item) {
        Objects.requireNonNull(item, "Item cannot be null");
        head = new Node<>(item, head);
        size++;
    }

    /**
     * Removes and returns the top item.
     *
     * @return the top item, or empty if the stack is empty
     */
    public Optional<T> pop() {
        if (head == null) {
            return Optional.empty();
        }
        T item = head.item;
        head = head.next;
        size--;
        return Optional.of(item);
    }

    /**
     * Returns the top item without removing it.
     *
     * @return the top item, or empty if the stack is empty
     */
    public Optional<T> peek() {
        return head == null ? Optional.empty() : Optional.of(head.item);
    }

    /**
     * Removes all items.
     */
    public void clear() {
        head = null;
        size = 0;
    }

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return head == null;
    }

    /**
     * Returns the items from top to bottom.
     *
     * @return a new list, top item first
     */
    public List<T> toList() {
        List<T> items = new ArrayList<>(size);
        for (Node<T> node = head; node != null; node = node.next) {
            items.add(node.item);
        }
        return items;
    }

    @Override
    public String toString() {
        return "LinkedStack" + toList();
    }

    private static final class Node<T> {
        private final T item;
        private final Node<T> next;

        private Node(T item, Node<T> next) {
            this.item = item;
            this.next = next;
        }
    }
}
