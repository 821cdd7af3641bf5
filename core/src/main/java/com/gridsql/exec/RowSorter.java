package com.gridsql.exec;

import com.gridsql.statement.OrderItem;
import com.gridsql.types.CellValue;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Function;

/**
 * Stable multi-key sort used by SELECT and by mutation target selection.
 *
 * <p>Keys are compared with {@link CellValueComparator#SORT_ORDER}; ascending keys put
 * Null first and descending keys put it last. Rows equal on every key keep their input
 * order when the last key is ascending and reverse it when the last key is descending,
 * so sorting a set by one key DESC yields the exact reverse of sorting it ASC.
 */
final class RowSorter {

    private RowSorter() {}

    /**
     * Sorts items by ORDER BY keys.
     *
     * @param items the items
     * @param orderBy the keys (empty keeps the input order)
     * @param contextOf how to evaluate keys against an item
     * @param evaluator the evaluator
     * @param <T> the item type
     * @return a new sorted list
     */
    static <T> List<T> sort(List<T> items, List<OrderItem> orderBy,
                            Function<T, RowContext> contextOf, ExpressionEvaluator evaluator) {
        if (orderBy.isEmpty() || items.size() < 2) {
            return new ArrayList<>(items);
        }
        List<List<CellValue>> keys = new ArrayList<>(items.size());
        for (T item : items) {
            RowContext ctx = contextOf.apply(item);
            List<CellValue> key = new ArrayList<>(orderBy.size());
            for (OrderItem order : orderBy) {
                key.add(evaluator.evaluate(order.expression(), ctx));
            }
            keys.add(key);
        }
        boolean lastDescending = orderBy.get(orderBy.size() - 1).isDescending();
        Comparator<Integer> comparator = (i, j) -> {
            List<CellValue> a = keys.get(i);
            List<CellValue> b = keys.get(j);
            for (int k = 0; k < orderBy.size(); k++) {
                int c = CellValueComparator.compareForSort(a.get(k), b.get(k));
                if (c != 0) {
                    return orderBy.get(k).isDescending() ? -c : c;
                }
            }
            return lastDescending ? Integer.compare(j, i) : Integer.compare(i, j);
        };
        List<Integer> indexes = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) {
            indexes.add(i);
        }
        indexes.sort(comparator);
        List<T> sorted = new ArrayList<>(items.size());
        for (int i : indexes) {
            sorted.add(items.get(i));
        }
        return sorted;
    }

    /**
     * Applies OFFSET then LIMIT.
     *
     * @param items the items
     * @param offset rows to skip (may be null)
     * @param limit rows to keep (may be null)
     * @param <T> the item type
     * @return the window
     */
    static <T> List<T> page(List<T> items, Integer offset, Integer limit) {
        int from = offset == null ? 0 : Math.min(offset, items.size());
        int to = limit == null ? items.size() : (int) Math.min((long) from + limit, items.size());
        return new ArrayList<>(items.subList(from, to));
    }
}
