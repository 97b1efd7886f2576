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

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;

/**
 * Parsing of date and timestamp literals in the forms {@code 2020-01-01}, {@code 2020-01-01 10:00},
 * {@code 2020-01-01T10:00:00.5} and {@code 2020-01-01 10:00:00+08}.
 */
final class TemporalLiterals {

    private static final DateTimeFormatter FORMATTER = new DateTimeFormatterBuilder()
        .append(DateTimeFormatter.ISO_LOCAL_DATE)
        .optionalStart()
        .appendLiteral(' ')
        .append(DateTimeFormatter.ISO_LOCAL_TIME)
        .optionalEnd()
        .optionalStart()
        .appendOffset("+HH:mm", "Z")
        .optionalEnd()
        .toFormatter();

    private TemporalLiterals() {
    }

    static TemporalAccessor parse(String text) {
        String normalized = StringUtils.trim(text);
        if (StringUtils.isEmpty(normalized)) {
            return null;
        }
        normalized = normalized.replace('T', ' ');
        try {
            return FORMATTER.parse(normalized);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    static LocalDate toLocalDate(TemporalAccessor parsed) {
        return LocalDate.from(parsed);
    }

    static LocalDateTime toLocalDateTime(TemporalAccessor parsed) {
        LocalDate date = LocalDate.from(parsed);
        if (!parsed.isSupported(ChronoField.HOUR_OF_DAY)) {
            return date.atStartOfDay();
        }
        return LocalDateTime.of(date, LocalTime.from(parsed));
    }

    /**
     * Literals without an offset are taken as UTC.
     */
    static OffsetDateTime toOffsetDateTime(TemporalAccessor parsed) {
        LocalDateTime local = toLocalDateTime(parsed);
        if (!parsed.isSupported(ChronoField.OFFSET_SECONDS)) {
            return local.atOffset(ZoneOffset.UTC);
        }
        try {
            return local.atOffset(ZoneOffset.from(parsed));
        } catch (DateTimeException e) {
            return null;
        }
    }
}
