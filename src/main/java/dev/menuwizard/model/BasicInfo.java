package dev.menuwizard.model;

/**
 * Identity of the recipe or menu item being created.
 */
public record BasicInfo(
    String name,
    String description,
    String category,
    int servings
) {
    public BasicInfo {
        name = name == null ? "" : name;
        description = description == null ? "" : description;
        category = category == null ? "" : category;
    }

    public static BasicInfo empty() {
        return new BasicInfo("", "", "", 1);
    }

    public BasicInfo withName(String name) {
        return new BasicInfo(name, description, category, servings);
    }

    public BasicInfo withServings(int servings) {
        return new BasicInfo(name, description, category, servings);
    }
}
