/*
 * Copyright [2013-2021], Alibaba Group Holding Limited
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.alibaba.partgen.optimizer.partition.datatype;

import org.apache.commons.lang3.StringUtils;

import java.io.Serializable;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Locale;
import java.util.Objects;

/**
 * An interval literal split into months, days and microseconds, the way it is added to temporal
 * values: months first, then days, then the time part.
 */
public final class IntervalValue implements Serializable {

    private static final long serialVersionUID = 3283760431829138171L;

    private static final long MICROS_PER_SECOND = 1_000_000L;
    private static final long MICROS_PER_MINUTE = 60 * MICROS_PER_SECOND;
    private static final long MICROS_PER_HOUR = 60 * MICROS_PER_MINUTE;

    private final int months;
    private final int days;
    private final long micros;

    public IntervalValue(int months, int days, long micros) {
        this.months = months;
        this.days = days;
        this.micros = micros;
    }

    public static IntervalValue ofMonths(int months) {
        return new IntervalValue(months, 0, 0);
    }

    public static IntervalValue ofDays(int days) {
        return new IntervalValue(0, days, 0);
    }

    public static IntervalValue ofHours(long hours) {
        return new IntervalValue(0, 0, Math.multiplyExact(hours, MICROS_PER_HOUR));
    }

    /**
     * Parse literals such as {@code '1 year'}, {@code '2 mons 3 days'} or {@code '1 day 04:05:06'}.
     *
     * @throws IllegalArgumentException if the text is not a valid interval
     */
    public static IntervalValue parse(String text) {
        IntervalValue value = tryParse(text);
        if (value == null) {
            throw new IllegalArgumentException("invalid input syntax for type interval: \"" + text + "\"");
        }
        return value;
    }

    public static IntervalValue tryParse(String text) {
        if (StringUtils.isBlank(text)) {
            return null;
        }
        String[] tokens = StringUtils.split(text.trim().toLowerCase(Locale.ROOT));
        long months = 0;
        long days = 0;
        long micros = 0;
        int i = 0;
        try {
            while (i < tokens.length) {
                String token = tokens[i];
                if (token.indexOf(':') > 0) {
                    micros = Math.addExact(micros, parseTime(token));
                    i++;
                    continue;
                }
                long amount = Long.parseLong(token);
                if (i + 1 >= tokens.length) {
                    // a bare number is a number of seconds
                    micros = Math.addExact(micros, Math.multiplyExact(amount, MICROS_PER_SECOND));
                    i++;
                    continue;
                }
                String unit = tokens[i + 1];
                switch (unit) {
                case "year":
                case "years":
                case "yr":
                case "yrs":
                    months = Math.addExact(months, Math.multiplyExact(amount, 12L));
                    break;
                case "month":
                case "months":
                case "mon":
                case "mons":
                    months = Math.addExact(months, amount);
                    break;
                case "week":
                case "weeks":
                    days = Math.addExact(days, Math.multiplyExact(amount, 7L));
                    break;
                case "day":
                case "days":
                    days = Math.addExact(days, amount);
                    break;
                case "hour":
                case "hours":
                case "hr":
                case "hrs":
                    micros = Math.addExact(micros, Math.multiplyExact(amount, MICROS_PER_HOUR));
                    break;
                case "minute":
                case "minutes":
                case "min":
                case "mins":
                    micros = Math.addExact(micros, Math.multiplyExact(amount, MICROS_PER_MINUTE));
                    break;
                case "second":
                case "seconds":
                case "sec":
                case "secs":
                    micros = Math.addExact(micros, Math.multiplyExact(amount, MICROS_PER_SECOND));
                    break;
                case "millisecond":
                case "milliseconds":
                case "ms":
                    micros = Math.addExact(micros, Math.multiplyExact(amount, 1000L));
                    break;
                case "microsecond":
                case "microseconds":
                case "us":
                    micros = Math.addExact(micros, amount);
                    break;
                default:
                    return null;
                }
                i += 2;
            }
            return new IntervalValue(Math.toIntExact(months), Math.toIntExact(days), micros);
        } catch (NumberFormatException | ArithmeticException e) {
            return null;
        }
    }

    private static long parseTime(String token) {
        boolean negative = token.startsWith("-");
        String[] parts = StringUtils.split(negative ? token.substring(1) : token, ':');
        if (parts.length < 2 || parts.length > 3) {
            throw new NumberFormatException(token);
        }
        long hours = Long.parseLong(parts[0]);
        long minutes = Long.parseLong(parts[1]);
        long seconds = parts.length == 3 ? Long.parseLong(parts[2]) : 0;
        long total = hours * MICROS_PER_HOUR + minutes * MICROS_PER_MINUTE + seconds * MICROS_PER_SECOND;
        return negative ? -total : total;
    }

    public LocalDateTime addTo(LocalDateTime value) {
        return value.plusMonths(months).plusDays(days).plus(micros, ChronoUnit.MICROS);
    }

    public OffsetDateTime addTo(OffsetDateTime value) {
        return value.plusMonths(months).plusDays(days).plus(micros, ChronoUnit.MICROS);
    }

    public int getMonths() {
        return months;
    }

    public int getDays() {
        return days;
    }

    public long getMicros() {
        return micros;
    }

    public boolean isZero() {
        return months == 0 && days == 0 && micros == 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof IntervalValue)) {
            return false;
        }
        IntervalValue that = (IntervalValue) o;
        return months == that.months && days == that.days && micros == that.micros;
    }

    @Override
    public int hashCode() {
        return Objects.hash(months, days, micros);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        int years = months / 12;
        int mons = months % 12;
        if (years != 0) {
            sb.append(years).append(Math.abs(years) == 1 ? " year " : " years ");
        }
        if (mons != 0) {
            sb.append(mons).append(Math.abs(mons) == 1 ? " mon " : " mons ");
        }
        if (days != 0) {
            sb.append(days).append(Math.abs(days) == 1 ? " day " : " days ");
        }
        if (micros != 0 || sb.length() == 0) {
            long abs = Math.abs(micros);
            if (micros < 0) {
                sb.append('-');
            }
            sb.append(String.format("%02d:%02d:%02d", abs / MICROS_PER_HOUR,
                (abs % MICROS_PER_HOUR) / MICROS_PER_MINUTE, (abs % MICROS_PER_MINUTE) / MICROS_PER_SECOND));
            long fraction = abs % MICROS_PER_SECOND;
            if (fraction != 0) {
                sb.append(String.format(".%06d", fraction));
            }
        }
        return sb.toString().trim();
    }
}
