package ai.doctables.reconstructor.segment;

import ai.doctables.reconstructor.model.Fragment;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * All fragment rows concatenated in fragment order, page boundaries discarded, together with the
 * pages that contributed rows in first-seen order. Fragments without rows are skipped.
 */
record MergedFragments(List<List<String>> rows, List<Integer> pages) {

    MergedFragments {
        rows = List.copyOf(rows);
        pages = List.copyOf(pages);
    }

    static MergedFragments of(List<Fragment> fragments) {
        List<List<String>> rows = new ArrayList<>();
        Set<Integer> pages = new LinkedHashSet<>();
        if (fragments != null) {
            for (Fragment fragment : fragments) {
                if (fragment == null || fragment.isEmpty()) {
                    continue;
                }
                rows.addAll(fragment.data());
                pages.add(fragment.page());
            }
        }
        return new MergedFragments(rows, new ArrayList<>(pages));
    }

    boolean isEmpty() {
        return rows.isEmpty();
    }

    List<String> header() {
        return rows.get(0);
    }

    List<List<String>> dataRows() {
        return rows.isEmpty() ? List.of() : rows.subList(1, rows.size());
    }
}
