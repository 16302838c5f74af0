package io.campbellsci.parser.util;

import java.util.Collection;
import java.util.function.Function;

/** Helpers for turning collections into human-readable text for error messages. */
public class Renderer {
    /**
     * Render the items as a comma-separated list.
     *
     * @param items The items
     * @return The rendered list
     */
    public static <T> String renderList(final Collection<T> items) {
        return renderList(items, ", ", Object::toString);
    }

    /**
     * Render the items, separated by {@code separator}, using {@code renderer} for each item.
     *
     * @param items The items
     * @param separator The separator
     * @param renderer Turns an item into text
     * @return The rendered list
     */
    public static <T> String renderList(final Collection<T> items, final String separator,
            final Function<? super T, String> renderer) {
        final StringBuilder sb = new StringBuilder();
        String currentSeparator = "";
        for (final T item : items) {
            sb.append(currentSeparator).append(renderer.apply(item));
            currentSeparator = separator;
        }
        return sb.toString();
    }

    private Renderer() {}
}
