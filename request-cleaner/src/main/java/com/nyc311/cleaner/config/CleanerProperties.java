package com.nyc311.cleaner.config;

import com.nyc311.cleaner.model.CleaningRules;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "cleaner")
@Data
public class CleanerProperties {

    private Input input = new Input();
    private Output output = new Output();
    private Pipeline pipeline = new Pipeline();
    private Rules rules = new Rules();
    private Scheduling scheduling = new Scheduling();

    @Data
    public static class Input {
        private String csvPath = "data/311_Service_Requests_from_2010_to_Present.csv";
    }

    @Data
    public static class Output {
        private OutputMode mode = OutputMode.SQLITE;
        private Csv csv = new Csv();

        @Data
        public static class Csv {
            private String outputDir = "output";
            private boolean includeHeader = true;
        }

        public enum OutputMode {
            SQLITE, CSV, BOTH, NONE
        }
    }

    @Data
    public static class Pipeline {
        /** Normalise rows on the common fork-join pool; output order is unaffected. */
        private boolean parallel = false;
        private int topComplaintTypes = 15;
    }

    @Data
    public static class Rules {
        private int minCreatedYear = 2010;
        private int maxCreatedYear = 2026;
        private double minLatitude = 40.4;
        private double maxLatitude = 40.95;
        private double minLongitude = -74.3;
        private double maxLongitude = -73.6;
        private boolean rejectUnknownBoroughs = true;
        private List<String> categories = new ArrayList<>(CleaningRules.DEFAULT_CATEGORIES);
    }

    @Data
    public static class Scheduling {
        /** Spring's "-" disables the scheduled re-run. */
        private String cron = "-";
        private boolean runOnStartup = false;
    }
}
