package com.nyc311.cleaner.service;

import com.nyc311.cleaner.TestRows;
import com.nyc311.cleaner.exception.SchemaViolationException;
import com.nyc311.cleaner.model.CleanedRecord;
import com.nyc311.cleaner.model.DataQualitySummary;
import com.nyc311.cleaner.model.PipelineResult;
import com.nyc311.cleaner.model.RawRecord;
import com.nyc311.cleaner.model.SourceColumn;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class CleaningPipelineTest {

    private final CleaningPipeline pipeline = TestRows.pipeline();

    @Test
    void duplicateKeyLeavesOneRecord() {
        PipelineResult result = pipeline.clean(List.of(
                TestRows.row("100").build(),
                TestRows.row("100").build()));

        assertThat(result.table().records()).extracting(CleanedRecord::getUniqueKey).containsExactly("100");
        assertThat(result.quality().getDuplicatesRemoved()).isEqualTo(1);
    }

    @Test
    void boroughAliasAndEmptyBorough() {
        PipelineResult result = pipeline.clean(List.of(
                TestRows.row("1").with(SourceColumn.BOROUGH, "the bronx").build(),
                TestRows.row("2").with(SourceColumn.BOROUGH, "").build()));

        CleanedRecord bronx = result.table().records().get(0);
        CleanedRecord none = result.table().records().get(1);

        assertThat(bronx.getBorough()).isEqualTo("BRONX");
        assertThat(bronx.getFlags().hasValidBorough()).isTrue();
        assertThat(none.getBorough()).isNull();
        assertThat(none.getFlags().hasValidBorough()).isFalse();
    }

    @Test
    void outOfBoundsCoordinatesAreDroppedTogether() {
        CleanedRecord record = pipeline.clean(List.of(
                TestRows.row("1")
                        .with(SourceColumn.LATITUDE, "41.5")
                        .with(SourceColumn.LONGITUDE, "-73.9")
                        .build())).table().records().get(0);

        assertThat(record.getLatitude()).isNull();
        assertThat(record.getLongitude()).isNull();
        assertThat(record.getFlags().hasValidCoordinates()).isFalse();
    }

    @Test
    void createdBefore2010IsExcludedEntirely() {
        PipelineResult result = pipeline.clean(List.of(
                TestRows.row("1").with(SourceColumn.CREATED_DATE, "03/15/2009 10:00:00 AM").build(),
                TestRows.row("2").build()));

        assertThat(result.table().records()).extracting(CleanedRecord::getUniqueKey).containsExactly("2");
        assertThat(result.quality().getDateFilteredRecords()).isEqualTo(1);
    }

    @Test
    void duplicateWithOneAdmissibleDateKeepsTheKey() {
        RawRecord recent = TestRows.row("100").with(SourceColumn.CREATED_DATE, "03/15/2019 10:00:00 AM").build();
        RawRecord old = TestRows.row("100").with(SourceColumn.CREATED_DATE, "03/15/2009 10:00:00 AM").build();

        for (List<RawRecord> rows : List.of(List.of(recent, old), List.of(old, recent))) {
            PipelineResult result = pipeline.clean(rows);

            assertThat(result.table().records()).extracting(CleanedRecord::getUniqueKey).containsExactly("100");
            assertThat(result.table().records().get(0).getCreatedDate()).isEqualTo("2019-03-15");
            assertThat(result.quality().getDuplicatesRemoved()).isEqualTo(1);
            assertThat(result.quality().getDateFilteredRecords()).isZero();
        }
    }

    @Test
    void rowWithoutCreatedDateIsAdmitted() {
        CleanedRecord record = pipeline.clean(List.of(
                TestRows.row("1").with(SourceColumn.CREATED_DATE, "").build())).table().records().get(0);

        assertThat(record.getCreatedDate()).isNull();
        assertThat(record.getCreatedAt()).isNull();
        assertThat(record.getFlags().hasValidCreatedDate()).isFalse();
    }

    @Test
    void complaintCategoryBuckets() {
        List<CleanedRecord> records = pipeline.clean(List.of(
                TestRows.row("1").with(SourceColumn.COMPLAINT_TYPE, "Graffiti").build(),
                TestRows.row("2").with(SourceColumn.COMPLAINT_TYPE, "Rodent").build())).table().records();

        assertThat(records.get(0).getComplaintCategory()).isEqualTo("Other");
        assertThat(records.get(1).getComplaintCategory()).isEqualTo("Rodent");
    }

    @Test
    void malformedFieldsDegradeToFlagsWithoutAbortingTheBatch() {
        PipelineResult result = pipeline.clean(List.of(
                TestRows.row("1")
                        .with(SourceColumn.LATITUDE, "forty")
                        .with(SourceColumn.LONGITUDE, "-73.9")
                        .with(SourceColumn.CREATED_DATE, "02/30/2019 10:00:00 AM")
                        .with(SourceColumn.BOROUGH, "Gotham")
                        .build(),
                TestRows.row("2").build()));

        assertThat(result.table().size()).isEqualTo(2);
        CleanedRecord bad = result.table().records().get(0);
        assertThat(bad.getFlags().hasValidCoordinates()).isFalse();
        assertThat(bad.getBorough()).isNull();
        assertThat(bad.getCreatedAt()).isNull();
        assertThat(bad.getCreatedDate()).isEqualTo("2019-02-30");

        DataQualitySummary quality = result.quality();
        assertThat(quality.getRejectedCoordinates()).isEqualTo(1);
        assertThat(quality.getUnrecognisedBoroughs()).isEqualTo(1);
        assertThat(quality.getUnparseableCreatedDates()).isEqualTo(1);
    }

    @Test
    void passthroughFieldsAndDerivedTimesAreCarried() {
        CleanedRecord record = pipeline.clean(List.of(
                TestRows.row("42")
                        .with(SourceColumn.CREATED_DATE, "03/15/2019 10:00:00 AM")
                        .with(SourceColumn.CLOSED_DATE, "03/15/2019 01:30:00 PM")
                        .with(SourceColumn.INCIDENT_ZIP, "11201")
                        .with(SourceColumn.COMMUNITY_BOARD, "02 BROOKLYN")
                        .build())).table().records().get(0);

        assertThat(record.getAgency()).isEqualTo("NYPD");
        assertThat(record.getIncidentZip()).isEqualTo("11201");
        assertThat(record.getCommunityBoard()).isEqualTo("02 BROOKLYN");
        assertThat(record.getCity()).isNull();
        assertThat(record.getCreatedDate()).isEqualTo("2019-03-15");
        assertThat(record.getClosedDate()).isEqualTo("2019-03-15");
        assertThat(record.getCreatedAt()).isEqualTo(LocalDateTime.of(2019, 3, 15, 10, 0));
        assertThat(record.getResponseTimeHours()).isEqualTo(3.5);
        assertThat(record.getFlags().hasClosedDate()).isTrue();
    }

    @Test
    void closedBeforeCreatedHasNoResponseTime() {
        CleanedRecord record = pipeline.clean(List.of(
                TestRows.row("1")
                        .with(SourceColumn.CREATED_DATE, "03/15/2019 10:00:00 AM")
                        .with(SourceColumn.CLOSED_DATE, "03/14/2019 10:00:00 AM")
                        .build())).table().records().get(0);

        assertThat(record.getResponseTimeHours()).isNull();
    }

    @Test
    void missingColumnAbortsTheRun() {
        List<RawRecord> rows = List.of(
                TestRows.row("1").build(),
                TestRows.row("2").without(SourceColumn.LATITUDE).build());

        assertThatThrownBy(() -> pipeline.clean(rows))
                .isInstanceOf(SchemaViolationException.class)
                .hasMessageContaining("Latitude")
                .satisfies(e -> assertThat(((SchemaViolationException) e).getMissingColumns())
                        .containsExactly("Latitude"));
    }

    @Test
    void summaryCountsAddUp() {
        DataQualitySummary quality = pipeline.clean(List.of(
                TestRows.row("1").build(),
                TestRows.row("1").build(),
                TestRows.row("").build(),
                TestRows.row("2").with(SourceColumn.CREATED_DATE, "01/01/2030 10:00:00 AM").build(),
                TestRows.row("3").build())).quality();

        assertThat(quality.getRawRecords()).isEqualTo(5);
        assertThat(quality.getCleanedRecords()).isEqualTo(2);
        assertThat(quality.getMissingKeyRecords()
                + quality.getDuplicatesRemoved()
                + quality.getDateFilteredRecords()
                + quality.getCleanedRecords()).isEqualTo(quality.getRawRecords());
        assertThat(quality.discardedRecords()).isEqualTo(3);
    }

    @Test
    void parallelAndSequentialRunsAgree() {
        List<RawRecord> rows = new java.util.ArrayList<>();
        for (int i = 0; i < 500; i++) {
            rows.add(TestRows.row(String.valueOf(i % 400))
                    .with(SourceColumn.BOROUGH, i % 3 == 0 ? "kings" : "Unspecified")
                    .build());
        }

        PipelineResult sequential = pipeline.clean(rows);
        PipelineResult parallel = TestRows.pipeline(com.nyc311.cleaner.model.CleaningRules.defaults(), true).clean(rows);

        assertThat(parallel.table().records()).isEqualTo(sequential.table().records());
        assertThat(parallel.quality()).isEqualTo(sequential.quality());
    }

    @Test
    void emptyInputGivesEmptyTable() {
        PipelineResult result = pipeline.clean(List.of());

        assertThat(result.table().isEmpty()).isTrue();
        assertThat(result.quality().getRawRecords()).isZero();
    }
}
