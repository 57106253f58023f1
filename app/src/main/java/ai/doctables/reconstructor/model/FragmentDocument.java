package ai.doctables.reconstructor.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Everything the ingestion layer hands over for one document: its fragments in extraction order,
 * the full text of each page and an opaque extraction context.
 */
public record FragmentDocument(String name,
                               List<Fragment> fragments,
                               List<String> pageTexts,
                               Map<String, Object> context) {

    public FragmentDocument {
        name = Objects.requireNonNullElse(name, "document");
        fragments = List.copyOf(fragments == null ? List.of() : fragments);
        pageTexts = pageTexts == null
                ? List.of()
                : pageTexts.stream().map(text -> Objects.requireNonNullElse(text, "")).toList();
        context = context == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }

    public FragmentDocument(String name, List<Fragment> fragments) {
        this(name, fragments, List.of(), Map.of());
    }
}
