package com.enterprise.workflow.scheduler;

import com.enterprise.workflow.exception.SchedulerException;
import it.sauronsoftware.cron4j.SchedulingPattern;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.TimeZone;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class CronExpressionTest {
    
    private static final ZoneId UTC = ZoneId.of("UTC");
    
    @Test
    void testParseFields() throws Exception {
        CronExpression cron = CronExpression.parse("*/15 0 1,15 * 1-5");
        
        assertEquals(List.of(0, 15, 30, 45), cron.getMinutes());
        assertEquals(List.of(0), cron.getHours());
        assertEquals(List.of(1, 15), cron.getDaysOfMonth());
        assertEquals(range(1, 12), cron.getMonths());
        assertEquals(List.of(1, 2, 3, 4, 5), cron.getDaysOfWeek());
        assertEquals("*/15 0 1,15 * 1-5", cron.getExpression());
    }
    
    @Test
    void testCommonExpressions() throws Exception {
        CronExpression hourly = CronExpression.parse("0 * * * *");
        CronExpression quarterly = CronExpression.parse("*/15 * * * *");
        CronExpression officeHours = CronExpression.parse("0 9-17 * * *");
        
        assertEquals(List.of(0), hourly.getMinutes());
        assertEquals(range(0, 23), hourly.getHours());
        assertEquals(range(0, 6), hourly.getDaysOfWeek());
        assertEquals(List.of(0, 15, 30, 45), quarterly.getMinutes());
        assertEquals(range(9, 17), officeHours.getHours());
        assertEquals(range(1, 31), officeHours.getDaysOfMonth());
    }
    
    @Test
    void testStepForms() throws Exception {
        assertEquals(List.of(5, 25, 45), CronExpression.parse("5/20 * * * *").getMinutes());
        assertEquals(List.of(10, 13, 16, 19), CronExpression.parse("* 10-20/3 * * *").getHours());
        assertEquals(List.of(0, 6, 12, 18), CronExpression.parse("0 */6 * * *").getHours());
    }
    
    @Test
    void testListsAreDeduplicatedAndSorted() throws Exception {
        CronExpression cron = CronExpression.parse("30,5,5,0-10/5 * * * *");
        
        assertEquals(List.of(0, 5, 10, 30), cron.getMinutes());
    }
    
    @Test
    void testExtraWhitespace() throws Exception {
        CronExpression cron = CronExpression.parse("  0   9 * *  1 ");
        
        assertEquals(List.of(0), cron.getMinutes());
        assertEquals(List.of(9), cron.getHours());
    }
    
    @Test
    void testStepLargerThanFieldRange() throws Exception {
        CronExpression cron = CronExpression.parse("59/2147483647 */2147483647 * * *");
        
        assertEquals(List.of(59), cron.getMinutes());
        assertEquals(List.of(0), cron.getHours());
    }
    
    @Test
    void testInvalidExpressions() {
        List<String> invalid = List.of(
            "",
            "* * * *",
            "* * * * * *",
            "60 * * * *",
            "* 24 * * *",
            "* * 0 * *",
            "* * 32 * *",
            "* * * 0 *",
            "* * * 13 *",
            "* * * * 7",
            "5-1 * * * *",
            "*/0 * * * *",
            "70/5 * * * *",
            "*/x * * * *",
            "a * * * *",
            "1- * * * *",
            "1,,2 * * * *",
            "-1 * * * *",
            "+5 * * * *",
            "* +1 * * *",
            "*/+2 * * * *",
            "1-2-3 * * * *",
            "MON * * * *");
        
        for (String expression : invalid) {
            SchedulerException e = assertThrows(SchedulerException.class,
                () -> CronExpression.parse(expression), "expected rejection of '" + expression + "'");
            assertEquals(SchedulerException.Kind.INVALID_CRON, e.getKind());
        }
        assertThrows(SchedulerException.class, () -> CronExpression.parse(null));
    }
    
    @Test
    void testDayOfWeekZeroIsSunday() throws Exception {
        CronExpression sunday = CronExpression.parse("0 9 * * 0");
        CronExpression monday = CronExpression.parse("0 9 * * 1");
        ZonedDateTime sundayMorning = ZonedDateTime.of(2024, 3, 10, 9, 0, 0, 0, UTC);
        ZonedDateTime mondayMorning = ZonedDateTime.of(2024, 3, 11, 9, 0, 0, 0, UTC);
        
        assertTrue(sunday.matches(sundayMorning));
        assertFalse(sunday.matches(mondayMorning));
        assertTrue(monday.matches(mondayMorning));
        assertFalse(monday.matches(sundayMorning));
    }
    
    @Test
    void testSecondsAreIgnored() throws Exception {
        CronExpression cron = CronExpression.parse("30 14 * * *");
        
        assertTrue(cron.matches(ZonedDateTime.of(2024, 6, 1, 14, 30, 59, 999, UTC)));
        assertFalse(cron.matches(ZonedDateTime.of(2024, 6, 1, 14, 31, 0, 0, UTC)));
    }
    
    @Test
    void testDayOfMonthAndDayOfWeekMustBothMatch() throws Exception {
        CronExpression fridayThe13th = CronExpression.parse("0 0 13 * 5");
        
        assertTrue(fridayThe13th.matches(ZonedDateTime.of(2024, 9, 13, 0, 0, 0, 0, UTC)));
        // Wednesday the 13th
        assertFalse(fridayThe13th.matches(ZonedDateTime.of(2024, 3, 13, 0, 0, 0, 0, UTC)));
        // Friday the 6th
        assertFalse(fridayThe13th.matches(ZonedDateTime.of(2024, 9, 6, 0, 0, 0, 0, UTC)));
    }
    
    @Test
    void testMatchesInTheTimesOwnZone() throws Exception {
        CronExpression cron = CronExpression.parse("0 9 * * *");
        Instant instant = Instant.parse("2024-03-11T00:00:00Z");
        
        assertTrue(cron.matches(ZonedDateTime.ofInstant(instant, ZoneId.of("Asia/Tokyo"))));
        assertFalse(cron.matches(ZonedDateTime.ofInstant(instant, UTC)));
    }
    
    @Test
    void testAgreesWithCron4j() throws Exception {
        List<String> expressions = List.of(
            "* * * * *",
            "*/15 * * * *",
            "0 9-17 * * 1-5",
            "30 2 1 * *",
            "0,30 */2 * 1-6 0",
            "5-55/10 * 10-20 * *",
            "0 0 13 * 5",
            "15 3 * 2,8 6");
        Instant start = Instant.parse("2024-01-01T00:00:00Z");
        
        for (String zoneName : List.of("UTC", "America/New_York")) {
            ZoneId zone = ZoneId.of(zoneName);
            TimeZone timeZone = TimeZone.getTimeZone(zoneName);
            for (String expression : expressions) {
                CronExpression cron = CronExpression.parse(expression);
                SchedulingPattern reference = new SchedulingPattern(expression);
                for (int i = 0; i < 20000; i++) {
                    Instant instant = start.plusSeconds(i * 37L * 60);
                    boolean expected = reference.match(timeZone, instant.toEpochMilli());
                    assertEquals(expected, cron.matches(ZonedDateTime.ofInstant(instant, zone)),
                        expression + " at " + instant + " in " + zoneName);
                }
            }
        }
    }
    
    private static List<Integer> range(int from, int to) {
        return IntStream.rangeClosed(from, to).boxed().collect(Collectors.toList());
    }
}
