package com.neolms.studygroups.util;

import com.neolms.studygroups.dto.CreateGroupRequest;
import com.neolms.studygroups.exception.ValidationException;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StudyGroupValidatorTest {

    @Nested
    class Draft {

        @Test
        void nameOfThreeCharacters_IsAccepted() {
            assertThatCode(() -> StudyGroupValidator.validateDraft(new CreateGroupRequest("abc", null, false)))
                .doesNotThrowAnyException();
        }

        @Test
        void nameOfTwoCharacters_IsRejected() {
            assertThatThrownBy(() -> StudyGroupValidator.validateDraft(new CreateGroupRequest("ab", null, false)))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("between 3 and 50");
        }

        @Test
        void nameOfFiftyOneCharacters_IsRejected() {
            CreateGroupRequest draft = new CreateGroupRequest("x".repeat(51), null, false);

            assertThatThrownBy(() -> StudyGroupValidator.validateDraft(draft))
                .isInstanceOf(ValidationException.class);
        }

        @Test
        void missingDraft_IsRejected() {
            assertThatThrownBy(() -> StudyGroupValidator.validateDraft(null))
                .isInstanceOf(ValidationException.class);
        }

        @ParameterizedTest
        @ValueSource(ints = {4, 51})
        void maxMembersOutsideRange_IsRejected(int maxMembers) {
            CreateGroupRequest draft = new CreateGroupRequest("Chem Review", maxMembers, false);

            assertThatThrownBy(() -> StudyGroupValidator.validateDraft(draft))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("Maximum members");
        }

        @ParameterizedTest
        @ValueSource(ints = {5, 50})
        void maxMembersAtBounds_IsAccepted(int maxMembers) {
            CreateGroupRequest draft = new CreateGroupRequest("Chem Review", maxMembers, false);

            assertThatCode(() -> StudyGroupValidator.validateDraft(draft)).doesNotThrowAnyException();
        }

        @Test
        void longDescription_IsRejected() {
            CreateGroupRequest draft = new CreateGroupRequest("Chem Review", null, false);
            draft.setDescription("d".repeat(201));

            assertThatThrownBy(() -> StudyGroupValidator.validateDraft(draft))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("Description");
        }

        @Test
        void unknownCategory_IsRejected() {
            CreateGroupRequest draft = new CreateGroupRequest("Chem Review", null, false);
            draft.setCategory("party");

            assertThatThrownBy(() -> StudyGroupValidator.validateDraft(draft))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("Unknown category")
                .hasCauseInstanceOf(IllegalArgumentException.class);
        }

        @Test
        void categoryIsCaseInsensitive() {
            CreateGroupRequest draft = new CreateGroupRequest("Chem Review", null, false);
            draft.setCategory("project");

            assertThatCode(() -> StudyGroupValidator.validateDraft(draft)).doesNotThrowAnyException();
        }

        @Test
        void malformedColor_IsRejected() {
            CreateGroupRequest draft = new CreateGroupRequest("Chem Review", null, false);
            draft.setColor("blue");

            assertThatThrownBy(() -> StudyGroupValidator.validateDraft(draft))
                .isInstanceOf(ValidationException.class);
        }
    }

    @Nested
    class InviteLimits {

        @Test
        void nullLimits_MeanUnlimited() {
            assertThatCode(() -> StudyGroupValidator.validateInviteLimits(null, null)).doesNotThrowAnyException();
        }

        @ParameterizedTest
        @ValueSource(ints = {0, 366})
        void expiryOutOfRange_IsRejected(int days) {
            assertThatThrownBy(() -> StudyGroupValidator.validateInviteLimits(days, null))
                .isInstanceOf(ValidationException.class);
        }

        @Test
        void zeroMaxUses_IsRejected() {
            assertThatThrownBy(() -> StudyGroupValidator.validateInviteLimits(7, 0))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("maxUses");
        }
    }
}
