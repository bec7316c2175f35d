package com.dbkeeper.server.util;

import com.dbkeeper.server.enums.ScheduleTypeEnum;
import com.dbkeeper.server.exception.ValidationException;
import org.apache.commons.lang3.ObjectUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Spreads N jobs evenly over a window of hours, one cron expression per job.
 * Distinct expressions are guaranteed while {@code totalJobs <= windowHours * 60}.
 */
public class StaggerGenerator {

    public static final int DEFAULT_WEEK_DAY = 6;

    public static String generate(
            int index,
            int totalJobs,
            ScheduleTypeEnum scheduleType,
            int startHour,
            int windowHours,
            Integer weekDay) throws ValidationException {
        isParameterValid(totalJobs, scheduleType, startHour, windowHours, weekDay);
        if (index < 0 || index >= totalJobs) {
            throw new ValidationException(
                    "generate stagger failed. index %d out of range [0, %d)".formatted(index, totalJobs));
        }
        int intervalMinutes = windowHours * 60 / totalJobs;
        int offsetMinutes = index * intervalMinutes;
        int hour = (startHour + offsetMinutes / 60) % 24;
        int minute = offsetMinutes % 60;
        if (scheduleType == ScheduleTypeEnum.WEEKLY) {
            int day = ObjectUtils.isEmpty(weekDay) ? DEFAULT_WEEK_DAY : weekDay;
            return "%d %d * * %d".formatted(minute, hour, day);
        }
        return "%d %d * * *".formatted(minute, hour);
    }

    public static List<String> generateAll(
            int totalJobs,
            ScheduleTypeEnum scheduleType,
            int startHour,
            int windowHours,
            Integer weekDay) throws ValidationException {
        isParameterValid(totalJobs, scheduleType, startHour, windowHours, weekDay);
        List<String> result = new ArrayList<>(totalJobs);
        for (int i = 0; i < totalJobs; i++) {
            result.add(generate(i, totalJobs, scheduleType, startHour, windowHours, weekDay));
        }
        return result;
    }

    private static void isParameterValid(
            int totalJobs,
            ScheduleTypeEnum scheduleType,
            int startHour,
            int windowHours,
            Integer weekDay) throws ValidationException {
        if (totalJobs <= 0) {
            throw new ValidationException(
                    "generate stagger failed. totalJobs must be positive. totalJobs is %d".formatted(totalJobs));
        }
        if (ObjectUtils.isEmpty(scheduleType)) {
            throw new ValidationException("generate stagger failed. scheduleType is null");
        }
        if (startHour < 0 || startHour > 23) {
            throw new ValidationException(
                    "generate stagger failed. startHour must be in [0, 23]. startHour is %d".formatted(startHour));
        }
        if (windowHours < 1 || windowHours > 24) {
            throw new ValidationException(
                    "generate stagger failed. windowHours must be in [1, 24]. windowHours is %d"
                            .formatted(windowHours));
        }
        if (ObjectUtils.isNotEmpty(weekDay) && (weekDay < 0 || weekDay > 6)) {
            throw new ValidationException(
                    "generate stagger failed. weekDay must be in [0, 6]. weekDay is %d".formatted(weekDay));
        }
    }
}
