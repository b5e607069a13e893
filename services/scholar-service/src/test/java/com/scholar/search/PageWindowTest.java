package com.scholar.search;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class PageWindowTest {

    @Test
    void clampsPageAndSize() {
        assertEquals(new PageWindow(1, 10), PageWindow.of(null, null, 10, 100));
        assertEquals(new PageWindow(1, 10), PageWindow.of(0, -5, 10, 100));
        assertEquals(new PageWindow(3, 100), PageWindow.of(3, 500, 10, 100));
    }

    @Test
    void slicesRequestedPage() {
        List<Integer> items = List.of(1, 2, 3, 4, 5);
        PageWindow second = PageWindow.of(2, 2, 10, 100);

        assertEquals(List.of(3, 4), second.slice(items));
        assertEquals(List.of(5), PageWindow.of(3, 2, 10, 100).slice(items));
        assertTrue(PageWindow.of(4, 2, 10, 100).slice(items).isEmpty());
    }

    @Test
    void totalPagesRoundsUp() {
        PageWindow window = PageWindow.of(1, 4, 10, 100);

        assertEquals(0, window.totalPages(0));
        assertEquals(1, window.totalPages(4));
        assertEquals(3, window.totalPages(9));
    }
}
