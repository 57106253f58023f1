package ai.doctables.reconstructor.model;

/**
 * Whether a table mirrors one page of the source or was reassembled across pages.
 */
public enum TableType {
    PAGE_PRESERVED("page_preserved"),
    LOGICAL("logical");

    private final String label;

    TableType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
