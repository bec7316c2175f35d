package com.dbkeeper.server.util;

import com.dbkeeper.server.enums.ScheduleTypeEnum;
import com.dbkeeper.server.exception.ValidationException;
import org.junit.jupiter.api.Test;

import java.time.ZoneId;
import java.util.HashSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StaggerGeneratorTest {

    @Test
    void dailyJobsAreSpreadOverTheWindow() {
        assertEquals(List.of("0 1 * * *", "0 2 * * *", "0 3 * * *", "0 4 * * *"),
                StaggerGenerator.generateAll(4, ScheduleTypeEnum.DAILY, 1, 4, null));
    }

    @Test
    void weeklyJobsWrapPastMidnightAndDefaultToSaturday() {
        assertEquals(List.of("0 22 * * 6", "20 23 * * 6", "40 0 * * 6"),
                StaggerGenerator.generateAll(3, ScheduleTypeEnum.WEEKLY, 22, 4, null));
        assertEquals("20 23 * * 0", StaggerGenerator.generate(1, 3, ScheduleTypeEnum.WEEKLY, 22, 4, 0));
    }

    @Test
    void expressionsAreDistinctAndValidUpToOnePerMinute() {
        List<String> crons = StaggerGenerator.generateAll(240, ScheduleTypeEnum.DAILY, 0, 4, null);
        assertEquals(240, new HashSet<>(crons).size());
        for (String cron : crons) {
            assertTrue(CronEvaluator.isValid(cron, ZoneId.of("UTC")), cron);
        }
    }

    @Test
    void invalidParametersAreRejected() {
        assertThrows(ValidationException.class,
                () -> StaggerGenerator.generateAll(0, ScheduleTypeEnum.DAILY, 1, 4, null));
        assertThrows(ValidationException.class,
                () -> StaggerGenerator.generate(0, 0, ScheduleTypeEnum.DAILY, 1, 4, null));
        assertThrows(ValidationException.class,
                () -> StaggerGenerator.generate(3, 3, ScheduleTypeEnum.DAILY, 1, 4, null));
        assertThrows(ValidationException.class,
                () -> StaggerGenerator.generate(-1, 3, ScheduleTypeEnum.DAILY, 1, 4, null));
        assertThrows(ValidationException.class,
                () -> StaggerGenerator.generate(0, 3, ScheduleTypeEnum.DAILY, 24, 4, null));
        assertThrows(ValidationException.class,
                () -> StaggerGenerator.generate(0, 3, ScheduleTypeEnum.DAILY, 1, 0, null));
        assertThrows(ValidationException.class,
                () -> StaggerGenerator.generate(0, 3, ScheduleTypeEnum.DAILY, 1, 25, null));
        assertThrows(ValidationException.class,
                () -> StaggerGenerator.generate(0, 3, ScheduleTypeEnum.WEEKLY, 1, 4, 7));
        assertThrows(ValidationException.class,
                () -> StaggerGenerator.generate(0, 3, null, 1, 4, null));
    }
}
