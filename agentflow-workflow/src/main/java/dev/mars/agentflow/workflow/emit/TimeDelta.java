/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.agentflow.workflow.emit;

import java.time.ZonedDateTime;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A relative time such as {@code +25h}, {@code +3d}, {@code +1w},
 * {@code +1mo} or a combination like {@code +1d12h}.
 */
public final class TimeDelta {

    private static final Pattern DELTA = Pattern.compile("^\\+((?:\\d+(?:mo|w|d|h|m))+)$");
    private static final Pattern PART = Pattern.compile("(\\d+)(mo|w|d|h|m)");

    private final int months;
    private final int weeks;
    private final int days;
    private final int hours;
    private final int minutes;

    private TimeDelta(int months, int weeks, int days, int hours, int minutes) {
        this.months = months;
        this.weeks = weeks;
        this.days = days;
        this.hours = hours;
        this.minutes = minutes;
    }

    /**
     * @return the delta, or empty when {@code text} is not a relative time
     */
    public static Optional<TimeDelta> parse(String text) {
        Objects.requireNonNull(text, "Text cannot be null");
        Matcher matcher = DELTA.matcher(text.trim());
        if (!matcher.matches()) {
            return Optional.empty();
        }
        int months = 0;
        int weeks = 0;
        int days = 0;
        int hours = 0;
        int minutes = 0;
        Matcher part = PART.matcher(matcher.group(1));
        while (part.find()) {
            int amount = Integer.parseInt(part.group(1));
            switch (part.group(2)) {
                case "mo":
                    months += amount;
                    break;
                case "w":
                    weeks += amount;
                    break;
                case "d":
                    days += amount;
                    break;
                case "h":
                    hours += amount;
                    break;
                default:
                    minutes += amount;
            }
        }
        return Optional.of(new TimeDelta(months, weeks, days, hours, minutes));
    }

    public ZonedDateTime addTo(ZonedDateTime time) {
        return time.plusMonths(months).plusWeeks(weeks).plusDays(days).plusHours(hours).plusMinutes(minutes);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TimeDelta that = (TimeDelta) o;
        return months == that.months && weeks == that.weeks && days == that.days
                && hours == that.hours && minutes == that.minutes;
    }

    @Override
    public int hashCode() {
        return Objects.hash(months, weeks, days, hours, minutes);
    }

    @Override
    public String toString() {
        return "+" + (months > 0 ? months + "mo" : "") + (weeks > 0 ? weeks + "w" : "")
                + (days > 0 ? days + "d" : "") + (hours > 0 ? hours + "h" : "")
                + (minutes > 0 ? minutes + "m" : "");
    }
}
