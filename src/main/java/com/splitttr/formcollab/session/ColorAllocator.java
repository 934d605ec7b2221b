package com.splitttr.formcollab.session;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Round-robin color assignment over a fixed palette. Colors released on leave
 * are preferred over reusing one that is still taken; once the palette is
 * exhausted colors are shared.
 */
public class ColorAllocator {

    private final List<String> palette;
    private final Map<String, Integer> inUse = new HashMap<>();
    private int next;

    public ColorAllocator(List<String> palette) {
        if (palette == null || palette.isEmpty()) {
            throw new IllegalArgumentException("Color palette must not be empty");
        }
        this.palette = List.copyOf(palette);
    }

    public String allocate() {
        int size = palette.size();
        int chosen = next % size;
        for (int i = 0; i < size; i++) {
            int candidate = (next + i) % size;
            if (!inUse.containsKey(palette.get(candidate))) {
                chosen = candidate;
                break;
            }
        }
        next = (chosen + 1) % size;
        String color = palette.get(chosen);
        inUse.merge(color, 1, Integer::sum);
        return color;
    }

    public void release(String color) {
        inUse.computeIfPresent(color, (c, count) -> count > 1 ? count - 1 : null);
    }
}
