package dev.menuwizard.engine;

import dev.menuwizard.model.*;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static dev.menuwizard.model.Discriminator.MENU_ITEM;
import static dev.menuwizard.model.Discriminator.RECIPE;
import static dev.menuwizard.model.StepId.*;
import static org.assertj.core.api.Assertions.assertThat;

class NavigationControllerTest {

    private final NavigationController nav = new NavigationController(TestFixtures.registry());
    private final SessionFields recipe = TestFixtures.recipeFields();
    private final SessionFields menuItem = TestFixtures.menuItemFields();

    @Test
    void initializesOnCreationType() {
        assertThat(nav.currentStep()).isEqualTo(CREATION_TYPE);
        assertThat(nav.completedSteps()).isEmpty();
        assertThat(nav.busy()).isFalse();
        assertThat(nav.canChangeDiscriminator()).isTrue();
    }

    @Test
    void nextIsBlockedUntilCreationTypeChosen() {
        var result = nav.goNext(recipe, null);

        assertThat(result).isInstanceOf(NavigationResult.Blocked.class);
        assertThat(((NavigationResult.Blocked) result).errors())
            .containsExactly("Choose whether to create a recipe or a menu item");
        assertThat(nav.currentStep()).isEqualTo(CREATION_TYPE);
    }

    @Test
    void nextAdvancesAndMarksStepCompleted() {
        var result = nav.goNext(recipe, RECIPE);

        assertThat(result).isEqualTo(new NavigationResult.Moved(CREATION_TYPE, BASIC_INFO));
        assertThat(nav.currentStep()).isEqualTo(BASIC_INFO);
        assertThat(nav.isCompleted(CREATION_TYPE)).isTrue();
        assertThat(nav.canChangeDiscriminator()).isFalse();
    }

    @Test
    void nextWithErrorsNeverMoves() {
        nav.goNext(recipe, RECIPE);
        var broken = recipe.merge(FieldsPatch.of(new BasicInfo("", "", "", 0)));

        var result = nav.goNext(broken, RECIPE);

        assertThat(result.moved()).isFalse();
        assertThat(nav.currentStep()).isEqualTo(BASIC_INFO);
        assertThat(nav.isCompleted(BASIC_INFO)).isFalse();
    }

    @Test
    void previousIsNeverBlockedByValidation() {
        nav.goNext(recipe, RECIPE);
        var broken = recipe.merge(FieldsPatch.of(new BasicInfo("", "", "", 0)));
        assertThat(nav.goNext(broken, RECIPE).moved()).isFalse();

        var result = nav.goPrevious(RECIPE);

        assertThat(result).isEqualTo(new NavigationResult.Moved(BASIC_INFO, CREATION_TYPE));
    }

    @Test
    void previousOnFirstStepStays() {
        assertThat(nav.goPrevious(null)).isEqualTo(new NavigationResult.Stayed(CREATION_TYPE));
    }

    @Test
    void recipeFlowSkipsOptionalAndSalesSteps() {
        walk(recipe, RECIPE, 3);
        assertThat(nav.currentStep()).isEqualTo(COST_CALCULATION);

        nav.goNext(recipe, RECIPE);
        assertThat(nav.currentStep()).isEqualTo(PREVIEW);

        nav.goPrevious(RECIPE);
        assertThat(nav.currentStep()).isEqualTo(COST_CALCULATION);
    }

    @Test
    void menuItemFlowVisitsSalesSettings() {
        walk(menuItem, MENU_ITEM, 4);
        assertThat(nav.currentStep()).isEqualTo(SALES_SETTINGS);

        nav.goNext(menuItem, MENU_ITEM);
        assertThat(nav.currentStep()).isEqualTo(PREVIEW);
    }

    @Test
    void nextOnPreviewIsANoOp() {
        walk(recipe, RECIPE, 4);

        assertThat(nav.goNext(recipe, RECIPE)).isEqualTo(new NavigationResult.Stayed(PREVIEW));
        assertThat(nav.currentStep()).isEqualTo(PREVIEW);
    }

    @Test
    void jumpsOnlyToAdjacentCompletedOrEarlierSteps() {
        assertThat(nav.goToStep(INGREDIENTS, RECIPE)).isInstanceOf(NavigationResult.Refused.class);
        assertThat(nav.currentStep()).isEqualTo(CREATION_TYPE);

        assertThat(nav.goToStep(BASIC_INFO, RECIPE).moved()).isTrue();

        walk(recipe, RECIPE, 2);
        assertThat(nav.currentStep()).isEqualTo(COST_CALCULATION);

        assertThat(nav.goToStep(CREATION_TYPE, RECIPE).moved()).isTrue();
        // completed earlier, so reachable even though it is two steps ahead
        assertThat(nav.goToStep(INGREDIENTS, RECIPE).moved()).isTrue();
        // never passed with "next"
        nav.goToStep(CREATION_TYPE, RECIPE);
        assertThat(nav.goToStep(COST_CALCULATION, RECIPE)).isInstanceOf(NavigationResult.Refused.class);
    }

    @Test
    void jumpToStepOutsideTheFlowIsRefused() {
        walk(recipe, RECIPE, 3);

        var result = nav.goToStep(SALES_SETTINGS, RECIPE);

        assertThat(result).isInstanceOf(NavigationResult.Refused.class);
        assertThat(nav.currentStep()).isEqualTo(COST_CALCULATION);
    }

    @Test
    void busyRefusesEveryTransition() {
        walk(recipe, RECIPE, 4);
        nav.setBusy(true);

        assertThat(nav.goPrevious(RECIPE)).isInstanceOf(NavigationResult.Refused.class);
        assertThat(nav.goToStep(CREATION_TYPE, RECIPE)).isInstanceOf(NavigationResult.Refused.class);
        assertThat(nav.goNext(recipe, RECIPE)).isInstanceOf(NavigationResult.Refused.class);
        assertThat(nav.currentStep()).isEqualTo(PREVIEW);

        nav.setBusy(false);
        assertThat(nav.goPrevious(RECIPE).moved()).isTrue();
    }

    @Test
    void entersFromDeepLink() {
        var result = nav.enterFromLink("/recepthantering/wizard/basic-info", RECIPE);

        assertThat(result).isEqualTo(new NavigationResult.Moved(CREATION_TYPE, BASIC_INFO));
    }

    @Test
    void deepLinkStillHonoursJumpRules() {
        assertThat(nav.enterFromLink("/recepthantering/wizard/preview", RECIPE))
            .isInstanceOf(NavigationResult.Refused.class);
        assertThat(nav.enterFromLink("/recipes/42", RECIPE)).isInstanceOf(NavigationResult.Refused.class);
        assertThat(nav.currentStep()).isEqualTo(CREATION_TYPE);
    }

    @Test
    void parsesAndBuildsLinks() {
        assertThat(NavigationController.stepFromLink("/recepthantering/wizard/sales-settings"))
            .contains(SALES_SETTINGS);
        assertThat(NavigationController.stepFromLink("/recepthantering/wizard/unknown")).isEqualTo(Optional.empty());
        assertThat(NavigationController.stepFromLink(null)).isEmpty();
        assertThat(NavigationController.linkFor(COST_CALCULATION)).isEqualTo("/recepthantering/wizard/cost-calculation");
    }

    private void walk(SessionFields fields, Discriminator discriminator, int steps) {
        for (int i = 0; i < steps; i++) {
            assertThat(nav.goNext(fields, discriminator).moved()).isTrue();
        }
    }
}
