package ai.codenav.analyzer;

/**
 * Opaque handle identifying one declaration or reference site inside a {@link CodeModel}. Handles are only
 * meaningful to the model that produced them; all facts about the element are obtained by asking the model.
 *
 * @param id a model-specific identifier, stable for the lifetime of the model
 */
public record ElementHandle(String id) {
    public ElementHandle {
        if (id.isBlank()) {
            throw new IllegalArgumentException("id must not be blank");
        }
    }

    @Override
    public String toString() {
        return "ELEMENT[" + id + "]";
    }
}
