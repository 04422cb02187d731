package me.toymail.mailbox.store;

import java.util.Arrays;
import java.util.function.Predicate;

/**
 * Owning array of email slots. Capacity grows by doubling into a fresh array;
 * the count of used slots is tracked separately from the capacity.
 */
final class EmailArray {
    static final int INITIAL_CAPACITY = 25;

    private Email[] slots;
    private int count;

    EmailArray() {
        this(INITIAL_CAPACITY);
    }

    EmailArray(int capacity) {
        this.slots = new Email[Math.max(1, capacity)];
    }

    int size() {
        return count;
    }

    int capacity() {
        return slots.length;
    }

    Email get(int index) {
        if (index < 0 || index >= count) {
            throw new IndexOutOfBoundsException("Slot " + index + " out of range 0.." + count);
        }
        return slots[index];
    }

    /**
     * Appends an email, growing the array first when it is full.
     *
     * @return the real index of the new slot
     */
    int add(Email email) {
        if (count == slots.length) {
            slots = Arrays.copyOf(slots, slots.length * 2);
        }
        slots[count] = email;
        email.setIndex(count);
        return count++;
    }

    /**
     * Removes every email matching the predicate, keeping the survivors in
     * order and renumbering their real indices.
     *
     * @return the removed emails, in their old slot order
     */
    Email[] compact(Predicate<Email> remove) {
        Email[] kept = new Email[slots.length];
        Email[] removed = new Email[count];
        int k = 0;
        int r = 0;
        for (int i = 0; i < count; i++) {
            Email e = slots[i];
            if (remove.test(e)) {
                removed[r++] = e;
            } else {
                kept[k++] = e;
            }
        }
        for (int i = 0; i < k; i++) {
            kept[i].setIndex(i);
        }
        slots = kept;
        count = k;
        return Arrays.copyOf(removed, r);
    }

    void clear() {
        Arrays.fill(slots, 0, count, null);
        count = 0;
    }
}
