package com.delta.autoapply.run.fill;

import com.delta.autoapply.run.browser.FakeBrowserPage;
import com.delta.autoapply.run.browser.FakeElement;
import com.delta.autoapply.run.model.ApplicantAnswers;
import com.delta.autoapply.run.model.FieldPurpose;
import com.delta.autoapply.run.model.TacticOutcome;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ProfileFieldFillerTest {
    private final ProfileFieldFiller filler = new ProfileFieldFiller();

    @Test
    void prefersLabelAssociation() {
        FakeElement firstName = FakeElement.of("").labelled("First Name");
        FakeBrowserPage page = new FakeBrowserPage("https://example.com/apply").addLabelled(firstName);

        TacticOutcome outcome = filler.fill(page, FieldPurpose.FIRST_NAME, "Ada");

        assertThat(outcome.isFound()).isTrue();
        assertThat(outcome.tactic()).isEqualTo("label");
        assertThat(firstName.filledValue()).isEqualTo("Ada");
    }

    @Test
    void labelHitSkipsTextSearch() {
        FakeElement email = FakeElement.of("").labelled("Email");
        FakeBrowserPage page = new FakeBrowserPage("https://example.com/apply")
            .addLabelled(email)
            .addText(FakeElement.of("Email address").inContainer(FakeElement.of("")));

        TacticOutcome outcome = filler.fill(page, FieldPurpose.EMAIL, "ada@example.com");

        assertThat(outcome.tactic()).isEqualTo("label");
        assertThat(email.filledValue()).isEqualTo("ada@example.com");
        assertThat(page.textLookups()).isZero();
    }

    @Test
    void fallsBackToInputNearMatchingText() {
        FakeElement input = FakeElement.of("");
        FakeElement container = FakeElement.of("City").child(ProfileFieldFiller.TEXT_INPUTS, input);
        FakeElement caption = FakeElement.of("City / Town").inContainer(container);
        FakeBrowserPage page = new FakeBrowserPage("https://example.com/apply").addText(caption);

        TacticOutcome outcome = filler.fill(page, FieldPurpose.CITY, "London");

        assertThat(outcome.isFound()).isTrue();
        assertThat(outcome.tactic()).isEqualTo("text-proximity");
        assertThat(input.filledValue()).isEqualTo("London");
    }

    @Test
    void driverErrorMovesOnToNextCandidate() {
        FakeElement broken = FakeElement.of("").labelled("Email").failingWith(new IllegalStateException("detached"));
        FakeElement input = FakeElement.of("");
        FakeElement container = FakeElement.of("").child(ProfileFieldFiller.TEXT_INPUTS, input);
        FakeBrowserPage page = new FakeBrowserPage("https://example.com/apply")
            .addLabelled(broken)
            .addText(FakeElement.of("Email address").inContainer(container));

        TacticOutcome outcome = filler.fill(page, FieldPurpose.EMAIL, "ada@example.com");

        assertThat(outcome.isFound()).isTrue();
        assertThat(input.filledValue()).isEqualTo("ada@example.com");
    }

    @Test
    void reportsErrorWhenEveryCandidateFails() {
        FakeElement broken = FakeElement.of("").labelled("Phone").failingWith(new IllegalStateException("readonly"));
        FakeBrowserPage page = new FakeBrowserPage("https://example.com/apply").addLabelled(broken);

        TacticOutcome outcome = filler.fill(page, FieldPurpose.PHONE, "555");

        assertThat(outcome.kind()).isEqualTo(TacticOutcome.Kind.ERROR);
        assertThat(outcome.detail()).contains("readonly");
    }

    @Test
    void emptyValuesAreSkipped() {
        FakeElement linkedin = FakeElement.of("").labelled("LinkedIn");
        FakeBrowserPage page = new FakeBrowserPage("https://example.com/apply").addLabelled(linkedin);
        ApplicantAnswers answers = ApplicantAnswers.of("Ada Lovelace", "", "", "", "", " ", null, null, true, false, false, false);

        Map<FieldPurpose, TacticOutcome> outcomes = filler.fillAll(page, answers);

        assertThat(linkedin.filledValue()).isNull();
        assertThat(outcomes).containsOnlyKeys(FieldPurpose.FULL_NAME, FieldPurpose.FIRST_NAME, FieldPurpose.LAST_NAME);
        assertThat(outcomes.get(FieldPurpose.FULL_NAME).kind()).isEqualTo(TacticOutcome.Kind.NOT_FOUND);
    }

    @Test
    void onlyFirstFiveTextNodesAreConsidered() {
        FakeBrowserPage page = new FakeBrowserPage("https://example.com/apply");
        for (int i = 0; i < 5; i++) {
            page.addText(FakeElement.of("GitHub " + i));
        }
        FakeElement input = FakeElement.of("");
        page.addText(FakeElement.of("GitHub profile").inContainer(FakeElement.of("").child(ProfileFieldFiller.TEXT_INPUTS, input)));

        TacticOutcome outcome = filler.fill(page, FieldPurpose.GITHUB, "https://github.com/ada");

        assertThat(outcome.kind()).isEqualTo(TacticOutcome.Kind.NOT_FOUND);
        assertThat(input.filledValue()).isNull();
    }
}
