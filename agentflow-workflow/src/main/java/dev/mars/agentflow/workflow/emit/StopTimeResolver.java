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

import dev.mars.agentflow.core.SourcePosition;
import dev.mars.agentflow.core.exceptions.ErrorKind;
import dev.mars.agentflow.core.exceptions.WorkflowConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Turns {@code on.stop-after} into an absolute UTC time.
 *
 * <p>A relative value is measured from the injected {@link Clock}. Because that
 * would change on every compile, the time recorded in the previous lock file is
 * reused unless a refresh is requested. Reading the previous lock file is
 * advisory: when it cannot be read the value is recomputed.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-22
 * @version 1.0
 */
public class StopTimeResolver {
    private static final Logger logger = LoggerFactory.getLogger(StopTimeResolver.class);

    public static final DateTimeFormatter FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private static final List<DateTimeFormatter> ABSOLUTE_FORMATS = List.of(
            FORMAT,
            DateTimeFormatter.ISO_LOCAL_DATE_TIME,
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm"));

    private final Clock clock;

    public StopTimeResolver(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
    }

    /**
     * @param stopAfter         the authored value
     * @param previousLockFile  the lock file being replaced, or null
     * @param refresh           recompute relative values even when a previous one exists
     * @return the stop time formatted as {@code yyyy-MM-dd HH:mm:ss}
     * @throws WorkflowConfigurationException if the value is neither relative nor a date
     */
    public String resolve(String stopAfter, Path previousLockFile, boolean refresh, String sourcePath,
                          SourcePosition position) throws WorkflowConfigurationException {
        String value = stopAfter.trim();
        Optional<TimeDelta> delta = TimeDelta.parse(value);
        if (delta.isEmpty()) {
            return parseAbsolute(value).orElseThrow(() -> new WorkflowConfigurationException(
                    ErrorKind.INVALID_CONFIGURATION, sourcePath, position, "on.stop-after",
                    "stop-after must be a relative time like '+25h', '+3d', '+1w' or '+1mo', "
                            + "or a date like 'yyyy-MM-dd HH:mm:ss'; got '" + stopAfter + "'"));
        }

        if (!refresh && previousLockFile != null) {
            Optional<String> previous = readPrevious(previousLockFile);
            if (previous.isPresent()) {
                logger.debug("Keeping stop time {} from {}", previous.get(), previousLockFile);
                return previous.get();
            }
        }
        ZonedDateTime now = ZonedDateTime.now(clock).withZoneSameInstant(ZoneOffset.UTC).truncatedTo(ChronoUnit.SECONDS);
        return FORMAT.format(delta.get().addTo(now));
    }

    static Optional<String> parseAbsolute(String value) {
        for (DateTimeFormatter format : ABSOLUTE_FORMATS) {
            try {
                return Optional.of(FORMAT.format(LocalDateTime.parse(value, format)));
            } catch (DateTimeParseException e) {
                logger.trace("'{}' does not match {}", value, format);
            }
        }
        try {
            return Optional.of(FORMAT.format(LocalDate.parse(value).atStartOfDay()));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    private static Optional<String> readPrevious(Path lockFile) {
        if (!Files.isRegularFile(lockFile)) {
            return Optional.empty();
        }
        try {
            String content = Files.readString(lockFile, StandardCharsets.UTF_8);
            return LockFileHeader.parseStopTime(content).flatMap(StopTimeResolver::parseAbsolute);
        } catch (IOException e) {
            logger.warn("Could not read previous lock file {}; recomputing stop time: {}", lockFile, e.getMessage());
            return Optional.empty();
        }
    }
}
