package dev.menuwizard.model;

/**
 * What the API gateway returns for a saved recipe or menu item.
 */
public record CommittedEntity(
    String id,
    String name
) {}
