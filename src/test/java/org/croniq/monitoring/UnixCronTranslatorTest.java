package org.croniq.monitoring;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class UnixCronTranslatorTest {

    @Test
    void addsSecondsAndQuestionMarkForDayOfWeek() throws ScheduleException {
        assertThat(UnixCronTranslator.toQuartz("0 0 * * *")).containsExactly("0 0 0 * * ?");
        assertThat(UnixCronTranslator.toQuartz("*/5 * * * *")).containsExactly("0 */5 * * * ?");
    }

    @Test
    void keepsLeadingSecondsOfSixFieldExpressions() throws ScheduleException {
        assertThat(UnixCronTranslator.toQuartz("15 30 2 * * *")).containsExactly("15 30 2 * * ?");
    }

    @Test
    void dayOfWeekRestrictionMovesQuestionMarkToDayOfMonth() throws ScheduleException {
        assertThat(UnixCronTranslator.toQuartz("0 9 * * 1-5")).containsExactly("0 0 9 ? * 2,3,4,5,6");
        assertThat(UnixCronTranslator.toQuartz("0 9 * * MON,FRI")).containsExactly("0 0 9 ? * 2,6");
    }

    @Test
    void rangeEndingOnSevenWrapsToSunday() throws ScheduleException {
        assertThat(UnixCronTranslator.toQuartz("0 12 * * 5-7")).containsExactly("0 0 12 ? * 1,6,7");
    }

    @Test
    void lastAndNthWeekdayForms() throws ScheduleException {
        assertThat(UnixCronTranslator.toQuartz("0 8 * * 5L")).containsExactly("0 0 8 ? * 6L");
        assertThat(UnixCronTranslator.toQuartz("0 8 * * 1#2")).containsExactly("0 0 8 ? * 2#2");
    }

    @Test
    void dayOfMonthRestrictionKeepsDayOfWeekAsQuestionMark() throws ScheduleException {
        assertThat(UnixCronTranslator.toQuartz("0 0 1 * *")).containsExactly("0 0 0 1 * ?");
    }

    @Test
    void bothDayFieldsRestrictedSplitsIntoOneExpressionPerField() throws ScheduleException {
        assertThat(UnixCronTranslator.toQuartz("0 0 1 * 1")).containsExactly("0 0 0 1 * ?", "0 0 0 ? * 2");
        assertThat(UnixCronTranslator.toQuartz("30 4 1,15 * 5-7")).containsExactly("0 30 4 1,15 * ?", "0 30 4 ? * 1,6,7");
    }

    @Test
    void rejectsWrongFieldCount() {
        assertThatThrownBy(() -> UnixCronTranslator.toQuartz("* * * *")).isInstanceOf(ScheduleException.class);
        assertThatThrownBy(() -> UnixCronTranslator.toQuartz("  ")).isInstanceOf(ScheduleException.class);
    }
}
