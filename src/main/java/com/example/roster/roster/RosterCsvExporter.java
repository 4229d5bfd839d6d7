package com.example.roster.roster;

import com.example.roster.schedule.Assignment;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.StringJoiner;

/**
 * ロスターのCSV出力。Excel で開けるよう BOM 付き UTF-8。
 */
@Component
public class RosterCsvExporter {

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ISO_LOCAL_DATE;
    static final String[] HEADERS = {
            "Date", "Day", "Employee Name", "Employee ID", "Hours", "Shift Code", "Shift Time",
            "Employment Type", "Status", "Station", "Store", "Manager"
    };

    public CsvFile export(List<Assignment> assignments, LocalDate startDate) {
        StringBuilder builder = new StringBuilder();
        builder.append('\uFEFF');
        builder.append(String.join(",", HEADERS)).append('\n');
        assignments.forEach(a -> appendRow(builder, a));

        byte[] data = builder.toString().getBytes(StandardCharsets.UTF_8);
        String filename = "roster-" + DATE_FORMAT.format(startDate) + ".csv";
        return new CsvFile(filename, data);
    }

    private void appendRow(StringBuilder builder, Assignment a) {
        StringJoiner joiner = new StringJoiner(",");
        joiner.add(escapeCsv(DATE_FORMAT.format(a.date())));
        joiner.add(escapeCsv(a.weekday()));
        joiner.add(escapeCsv(a.workerName()));
        joiner.add(escapeCsv(a.workerId()));
        joiner.add(escapeCsv(formatHours(a.hours())));
        joiner.add(escapeCsv(a.shiftCode()));
        joiner.add(escapeCsv(a.shiftTime()));
        joiner.add(escapeCsv(a.employmentClass() == null ? "" : a.employmentClass().getLabel()));
        joiner.add(escapeCsv(a.status() == null ? "" : a.status().getLabel()));
        joiner.add(escapeCsv(a.station()));
        joiner.add(escapeCsv(a.store()));
        joiner.add(escapeCsv(a.managerName()));
        builder.append(joiner).append('\n');
    }

    private String formatHours(double hours) {
        return BigDecimal.valueOf(hours).stripTrailingZeros().toPlainString();
    }

    private String escapeCsv(String value) {
        String target = value == null ? "" : value;
        if (target.contains(",") || target.contains("\"") || target.contains("\n")) {
            return "\"" + target.replace("\"", "\"\"") + "\"";
        }
        return target;
    }

    public record CsvFile(String filename, byte[] data) { }
}
