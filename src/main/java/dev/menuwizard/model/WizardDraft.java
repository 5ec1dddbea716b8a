package dev.menuwizard.model;

/**
 * Pre-filled data for a session, e.g. an existing recipe opened for editing.
 */
public record WizardDraft(
    Discriminator discriminator, // nullable
    String entityId, // null creates, non-null updates
    SessionFields fields
) {
    public WizardDraft {
        fields = fields == null ? SessionFields.defaults() : fields;
    }
}
