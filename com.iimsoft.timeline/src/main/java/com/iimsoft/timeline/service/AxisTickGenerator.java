package com.iimsoft.timeline.service;

import com.iimsoft.timeline.calendar.DateUnit;
import com.iimsoft.timeline.calendar.DateUtils;
import com.iimsoft.timeline.calendar.ViewMode;
import com.iimsoft.timeline.domain.AxisTick;
import com.iimsoft.timeline.domain.GanttRange;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 时间轴刻度生成工具。
 */
public class AxisTickGenerator {

    static final int UPPER_TEXT_OFFSET = 25;

    /**
     * 从 range.start 开始，每次加一个刻度单位（年 / 月 / step 小时），直到到达 range.end。
     * 第一个不早于 range.end 的刻度也包含在内。
     */
    public static List<LocalDateTime> tickDates(GanttRange range, TimeScale scale) {
        List<LocalDateTime> dates = new ArrayList<>();
        LocalDateTime cur = range.getStart();
        dates.add(cur);
        while (cur.isBefore(range.getEnd())) {
            if (scale.is(ViewMode.YEAR)) {
                cur = DateUtils.add(cur, 1, DateUnit.YEAR);
            } else if (scale.is(ViewMode.MONTH)) {
                cur = DateUtils.add(cur, 1, DateUnit.MONTH);
            } else {
                cur = DateUtils.add(cur, scale.getStep(), DateUnit.HOUR);
            }
            dates.add(cur);
        }
        return dates;
    }

    /**
     * 生成带标签和位置的刻度。
     *
     * @param headerHeight 表头高度，下行标签的 y
     * @param language     月份名称语言
     */
    public static List<AxisTick> axisTicks(GanttRange range, TimeScale scale, int headerHeight, String language) {
        List<LocalDateTime> dates = tickDates(range, scale);

        // Month 视图：每年有几个刻度，用来把年份标签放在该年中间
        Map<Integer, Integer> ticksPerYear = new HashMap<>();
        if (scale.is(ViewMode.MONTH)) {
            for (LocalDateTime d : dates) {
                ticksPerYear.merge(d.getYear(), 1, Integer::sum);
            }
        }

        List<AxisTick> ticks = new ArrayList<>(dates.size());
        double gridX = 0;
        for (int i = 0; i < dates.size(); i++) {
            LocalDateTime date = dates.get(i);
            LocalDateTime last = i > 0 ? dates.get(i - 1) : null;
            ticks.add(buildTick(date, last, i, gridX, scale, headerHeight, language, ticksPerYear));

            if (scale.is(ViewMode.MONTH)) {
                gridX += DateUtils.daysInMonth(date) * scale.getColumnWidth() / 30.0;
            } else {
                gridX += scale.getColumnWidth();
            }
        }
        return ticks;
    }

    private static AxisTick buildTick(LocalDateTime date, LocalDateTime last, int i, double gridX,
                                      TimeScale scale, int headerHeight, String language,
                                      Map<Integer, Integer> ticksPerYear) {
        boolean first = last == null;
        boolean dayChanged = first || date.getDayOfMonth() != last.getDayOfMonth();
        boolean monthChanged = first || date.getMonthValue() != last.getMonthValue();
        boolean yearChanged = first || date.getYear() != last.getYear();
        int cw = scale.getColumnWidth();

        String lower;
        String upper;
        double lowerOffset;
        double upperOffset;
        switch (scale.getViewMode()) {
            case QUARTER_DAY:
                lower = DateUtils.format(date, "HH", language);
                upper = dayChanged ? DateUtils.format(date, "D MMM", language) : "";
                lowerOffset = 0;
                upperOffset = cw * 4 / 2.0;
                break;
            case HALF_DAY:
                lower = DateUtils.format(date, "HH", language);
                if (!dayChanged) {
                    upper = "";
                } else {
                    upper = monthChanged
                            ? DateUtils.format(date, "D MMM", language)
                            : DateUtils.format(date, "D", language);
                }
                lowerOffset = 0;
                upperOffset = cw * 2 / 2.0;
                break;
            case DAY:
                lower = dayChanged ? DateUtils.format(date, "D", language) : "";
                upper = monthChanged ? DateUtils.format(date, "MMMM", language) : "";
                lowerOffset = cw / 2.0;
                upperOffset = cw * 30 / 2.0;
                break;
            case WEEK:
                lower = monthChanged
                        ? DateUtils.format(date, "D MMM", language)
                        : DateUtils.format(date, "D", language);
                if (monthChanged) {
                    String pattern = i < 5 || date.getMonthValue() == 1 ? "MMMM YYYY" : "MMMM";
                    upper = DateUtils.format(date, pattern, language);
                } else {
                    upper = "";
                }
                lowerOffset = 0;
                upperOffset = cw * 4 / 2.0;
                break;
            case MONTH:
                lower = DateUtils.format(date, "MMMM", language);
                upper = yearChanged ? DateUtils.format(date, "YYYY", language) : "";
                lowerOffset = cw / 2.0;
                upperOffset = cw * ticksPerYear.getOrDefault(date.getYear(), 1) / 2.0;
                break;
            case YEAR:
            default:
                lower = DateUtils.format(date, "YYYY", language);
                upper = yearChanged ? DateUtils.format(date, "YYYY", language) : "";
                lowerOffset = cw / 2.0;
                upperOffset = cw * 30 / 2.0;
                break;
        }

        double baseX = (double) i * cw;
        return new AxisTick(date,
                lower, baseX + lowerOffset, headerHeight,
                upper, baseX + upperOffset, headerHeight - UPPER_TEXT_OFFSET,
                gridX, isThick(date, scale));
    }

    // 粗刻度：Day 视图每月 1 号，Week 视图每月第一周，Month 视图每季度
    static boolean isThick(LocalDateTime date, TimeScale scale) {
        switch (scale.getViewMode()) {
            case DAY:
                return date.getDayOfMonth() == 1;
            case WEEK:
                return date.getDayOfMonth() >= 1 && date.getDayOfMonth() < 8;
            case MONTH:
                return (date.getMonthValue() - 1) % 3 == 0;
            default:
                return false;
        }
    }
}
