package com.gridcalc.app.services;

import com.gridcalc.app.dto.CellSnapshot;
import com.gridcalc.app.dto.CellUpdateRequest;
import com.gridcalc.app.dto.DependencyResponse;
import com.gridcalc.app.dto.EvaluationResponse;
import com.gridcalc.app.dto.ImportRowsRequest;
import com.gridcalc.app.dto.ParticipantResponse;
import com.gridcalc.app.dto.RangeSnapshot;
import com.gridcalc.app.dto.UpdateCellsRequest;
import com.gridcalc.app.dto.UpdateCellsResponse;
import com.gridcalc.app.exceptions.FormulaParseException;
import com.gridcalc.app.exceptions.InvalidRangeException;
import com.gridcalc.app.exceptions.SheetNotFoundException;
import com.gridcalc.app.exceptions.SpreadsheetNotFoundException;
import com.gridcalc.app.models.CellAddress;
import com.gridcalc.app.models.CellValue;
import com.gridcalc.app.models.ErrorCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Cell store and recalculation behaviour through SheetService, in memory.
 */
class SheetServiceTest {

    private EngineFixture fixture;
    private SheetService sheetService;
    private String spreadsheetId;

    @BeforeEach
    void setUp() {
        fixture = new EngineFixture();
        sheetService = fixture.sheetService;
        spreadsheetId = fixture.newSpreadsheet();
    }

    private UpdateCellsResponse set(String address, Object value) {
        return sheetService.setCell(spreadsheetId, 0, address, value, null);
    }

    private CellValue valueOf(String address) {
        return sheetService.getCell(spreadsheetId, 0, address).getValue();
    }

    private static List<String> addresses(List<CellSnapshot> snapshots) {
        List<String> result = new ArrayList<>();
        for (CellSnapshot snapshot : snapshots) {
            result.add(snapshot.getAddress());
        }
        return result;
    }

    /**
     * A3 = A1 + A2 follows its inputs.
     */
    @Test
    void testSimpleRecalculation() {
        set("A1", 5);
        set("A2", 10);
        set("A3", "=A1+A2");
        assertEquals(CellValue.number(15), valueOf("A3"));

        UpdateCellsResponse response = set("A1", 7);
        assertEquals(CellValue.number(17), valueOf("A3"));
        assertEquals(Collections.singletonList("A3"), addresses(response.getRecalculated()));
    }

    @Test
    void testRecalculationFollowsDependencyOrder() {
        set("A1", 1);
        set("B1", "=A1*2");
        set("C1", "=B1+A1");
        set("A2", "=C1");

        UpdateCellsResponse response = set("A1", 3);

        assertEquals(Arrays.asList("B1", "C1", "A2"), addresses(response.getRecalculated()));
        assertEquals(CellValue.number(6), valueOf("B1"));
        assertEquals(CellValue.number(9), valueOf("C1"));
        assertEquals(CellValue.number(9), valueOf("A2"));
    }

    @Test
    void testRangeReadersAreRecomputed() {
        set("B1", "=SUM(A1:A3)");
        set("A2", 4);
        set("A3", 6);
        assertEquals(CellValue.number(10), valueOf("B1"));
        set("A3", null);
        assertEquals(CellValue.number(4), valueOf("B1"));
    }

    /**
     * A1 = A2 and A2 = A1: both cells report #CIRCULAR!.
     */
    @Test
    void testCircularReference() {
        set("A1", "=A2");
        UpdateCellsResponse response = set("A2", "=A1");

        assertEquals(Collections.singletonList("A2"), response.getCircular());
        assertEquals(CellValue.error(ErrorCode.CIRCULAR), valueOf("A1"));
        assertEquals(CellValue.error(ErrorCode.CIRCULAR), valueOf("A2"));
    }

    @Test
    void testBreakingCycleRestoresValues() {
        set("A1", "=B1");
        set("B1", "=A1");
        assertEquals(CellValue.error(ErrorCode.CIRCULAR), valueOf("B1"));

        set("A1", 7);
        assertEquals(CellValue.number(7), valueOf("B1"));
        assertEquals(CellValue.number(7), valueOf("A1"));
    }

    @Test
    void testSelfReference() {
        UpdateCellsResponse response = set("C3", "=C3+1");
        assertEquals(Collections.singletonList("C3"), response.getCircular());
        assertEquals(CellValue.error(ErrorCode.CIRCULAR), valueOf("C3"));
    }

    /**
     * A1 = 1/0 and B1 = A1 + 1 both hold #DIV/0!.
     */
    @Test
    void testErrorPropagation() {
        set("A1", "=1/0");
        set("B1", "=A1+1");
        assertEquals(CellValue.error(ErrorCode.DIV_ZERO), valueOf("A1"));
        assertEquals(CellValue.error(ErrorCode.DIV_ZERO), valueOf("B1"));
    }

    @Test
    void testFormulaSourceRoundTrip() {
        set("D4", "=SUM( A1:A3 ) * 2");
        CellSnapshot snapshot = sheetService.getCell(spreadsheetId, 0, "d4");
        assertEquals("=SUM( A1:A3 ) * 2", snapshot.getContent());
        assertTrue(snapshot.isFormula());
        assertEquals(CellValue.number(0), snapshot.getValue());
    }

    @Test
    void testParseErrorLeavesStateUnchanged() {
        set("A1", 5);
        long revision = fixture.registry.require(spreadsheetId).getRevision();

        List<CellUpdateRequest> updates = new ArrayList<>();
        updates.add(new CellUpdateRequest("A1", 6));
        updates.add(new CellUpdateRequest("A2", "=(1+"));
        assertThrows(FormulaParseException.class, () ->
                sheetService.updateCells(spreadsheetId, 0, new UpdateCellsRequest(null, updates)));

        assertEquals(CellValue.number(5), valueOf("A1"));
        assertTrue(sheetService.getCell(spreadsheetId, 0, "A2").getValue().isEmpty());
        assertEquals(revision, fixture.registry.require(spreadsheetId).getRevision());
    }

    @Test
    void testBatchIsOneRevision() {
        List<CellUpdateRequest> updates = new ArrayList<>();
        updates.add(new CellUpdateRequest("A1", 1));
        updates.add(new CellUpdateRequest(0, 1, "=A1+1"));
        updates.add(new CellUpdateRequest("A1", 2));
        UpdateCellsResponse response = sheetService.updateCells(spreadsheetId, 0,
                new UpdateCellsRequest("p1", updates));

        assertEquals(1, response.getRevision());
        assertEquals("A1:B1", response.getUpdated().getRange());
        assertEquals(CellValue.number(3), valueOf("B1"));
        assertEquals("p1", sheetService.getCell(spreadsheetId, 0, "A1").getLastEditor());
    }

    @Test
    void testGetRange() {
        set("B2", "hello");
        RangeSnapshot range = sheetService.getRange(spreadsheetId, 0, 0, 2, 0, 1);
        assertEquals("A1:B3", range.getRange());
        assertEquals(3, range.getRows().size());
        assertEquals(2, range.getRows().get(0).size());
        assertEquals(CellValue.string("hello"), range.cellAt(1, 1).getValue());
        assertTrue(range.cellAt(0, 0).getValue().isEmpty());
    }

    @Test
    void testGetRangeRejectsBadBounds() {
        assertThrows(InvalidRangeException.class, () -> sheetService.getRange(spreadsheetId, 0, 0, 9, 0, 10));
        assertThrows(InvalidRangeException.class, () -> sheetService.getRange(spreadsheetId, 0, 3, 2, 0, 0));
        assertThrows(InvalidRangeException.class, () -> sheetService.getRange(spreadsheetId, 0, -1, 2, 0, 0));
        assertThrows(InvalidRangeException.class, () -> sheetService.getCell(spreadsheetId, 0, "1A"));
    }

    @Test
    void testGetRangeAtLargestIndex() {
        int max = CellAddress.MAX_INDEX;
        assertThrows(InvalidRangeException.class,
                () -> sheetService.getRange(spreadsheetId, 0, Integer.MAX_VALUE, Integer.MAX_VALUE, 0, 0));
        assertThrows(InvalidRangeException.class,
                () -> sheetService.getRange(spreadsheetId, 0, 0, 0, Integer.MAX_VALUE, Integer.MAX_VALUE));

        RangeSnapshot last = sheetService.getRange(spreadsheetId, 0, max, max, max, max);
        assertEquals(1, last.getRows().size());
        assertEquals(1, last.getRows().get(0).size());
        assertTrue(last.cellAt(0, 0).getValue().isEmpty());
    }

    /**
     * An index past the largest one rejects the batch before anything is stored or broadcast.
     */
    @Test
    void testOutOfBoundsEditLeavesStateUnchanged() {
        fixture.collaborationService.startSession(spreadsheetId);
        ParticipantResponse bob = fixture.collaborationService.join(spreadsheetId, "u-2", "Bob");

        List<CellUpdateRequest> updates = new ArrayList<>();
        updates.add(new CellUpdateRequest("A1", 1));
        updates.add(new CellUpdateRequest(Integer.MAX_VALUE, 0, 42));
        assertThrows(InvalidRangeException.class, () ->
                sheetService.updateCells(spreadsheetId, 0, new UpdateCellsRequest(null, updates)));
        assertThrows(InvalidRangeException.class, () ->
                sheetService.updateCells(spreadsheetId, 0, new UpdateCellsRequest(null,
                        Collections.singletonList(new CellUpdateRequest(0, Integer.MAX_VALUE, 42)))));

        assertTrue(valueOf("A1").isEmpty());
        assertEquals(0, fixture.registry.require(spreadsheetId).getRevision());
        assertTrue(fixture.collaborationService.pollEvents(spreadsheetId, bob.getParticipantId()).isEmpty());

        UpdateCellsResponse response = sheetService.updateCells(spreadsheetId, 0, new UpdateCellsRequest(null,
                Collections.singletonList(new CellUpdateRequest(CellAddress.MAX_INDEX, 0, 42))));
        assertEquals(1, response.getRevision());
        assertEquals("A2147483647", response.getUpdated().getRange());
        assertEquals(1, fixture.collaborationService.pollEvents(spreadsheetId, bob.getParticipantId()).size());
    }

    @Test
    void testFarApartEditsReturnOnlyEditedCells() {
        List<CellUpdateRequest> updates = new ArrayList<>();
        updates.add(new CellUpdateRequest("A1", 1));
        updates.add(new CellUpdateRequest("ZZZ100000", "=A1+1"));
        UpdateCellsResponse response = sheetService.updateCells(spreadsheetId, 0,
                new UpdateCellsRequest(null, updates));

        assertNull(response.getUpdated());
        assertEquals(Arrays.asList("A1", "ZZZ100000"), addresses(response.getEdited()));
        assertEquals(CellValue.number(2), response.getEdited().get(1).getValue());
        assertEquals(CellValue.number(2), valueOf("ZZZ100000"));
    }

    @Test
    void testEmptyBatchIsRejected() {
        assertThrows(InvalidRangeException.class, () -> sheetService.updateCells(spreadsheetId, 0,
                new UpdateCellsRequest(null, new ArrayList<>())));
    }

    @Test
    void testUnknownSpreadsheetAndSheet() {
        assertThrows(SpreadsheetNotFoundException.class, () -> sheetService.getCell("missing", 0, "A1"));
        assertThrows(SheetNotFoundException.class, () -> sheetService.getCell(spreadsheetId, 3, "A1"));
    }

    @Test
    void testConflictIsReported() {
        sheetService.setCell(spreadsheetId, 0, "A1", "first", "p1");

        CellUpdateRequest stale = new CellUpdateRequest("A1", "second");
        stale.setBaseRevision(0L);
        UpdateCellsResponse response = sheetService.updateCells(spreadsheetId, 0,
                new UpdateCellsRequest("p2", Collections.singletonList(stale)));

        assertEquals(1, response.getConflicts().size());
        assertEquals("A1", response.getConflicts().get(0).getAddress());
        assertEquals("p1", response.getConflicts().get(0).getOverwrittenParticipantId());
        // last write still wins
        assertEquals(CellValue.string("second"), valueOf("A1"));
    }

    @Test
    void testOwnRewriteIsNoConflict() {
        sheetService.setCell(spreadsheetId, 0, "A1", "first", "p1");
        CellUpdateRequest again = new CellUpdateRequest("A1", "second");
        again.setBaseRevision(0L);
        UpdateCellsResponse response = sheetService.updateCells(spreadsheetId, 0,
                new UpdateCellsRequest("p1", Collections.singletonList(again)));
        assertTrue(response.getConflicts().isEmpty());
    }

    @Test
    void testCrossSheetReference() {
        fixture.spreadsheetService.addSheet(spreadsheetId, "Data");
        sheetService.setCell(spreadsheetId, 1, "A1", 4, null);
        set("A1", "=Data!A1*10");
        assertEquals(CellValue.number(40), valueOf("A1"));

        UpdateCellsResponse response = sheetService.setCell(spreadsheetId, 1, "A1", 5, null);
        assertEquals(CellValue.number(50), valueOf("A1"));
        assertEquals(1, response.getRecalculated().size());
        assertEquals(0, response.getRecalculated().get(0).getSheetIndex());
    }

    @Test
    void testEvaluateFormula() {
        set("A1", 2);
        set("A2", 3);
        EvaluationResponse response = sheetService.evaluateFormula(spreadsheetId, 0, "A1*A2");
        assertEquals("=A1*A2", response.getFormula());
        assertEquals(CellValue.number(6), response.getValue());
        assertEquals(Arrays.asList("A1", "A2"), response.getReferences());
        assertTrue(sheetService.getCell(spreadsheetId, 0, "A3").getValue().isEmpty());
    }

    @Test
    void testImportRows() {
        List<List<Object>> rows = new ArrayList<>();
        rows.add(Arrays.<Object>asList("Region", "Amount"));
        rows.add(Arrays.<Object>asList("East", 10));
        rows.add(Arrays.<Object>asList("West", "=B3*2"));
        UpdateCellsResponse response = sheetService.importRows(spreadsheetId, 0, new ImportRowsRequest(1, 0, rows));

        assertEquals("A2:B4", response.getUpdated().getRange());
        assertEquals(CellValue.number(20), valueOf("B4"));
        assertThrows(InvalidRangeException.class, () -> sheetService.importRows(spreadsheetId, 0,
                new ImportRowsRequest(0, 0, new ArrayList<>())));
    }

    @Test
    void testDependencies() {
        set("B1", "=A1+A2");
        set("C1", "=SUM(A1:A5)");

        DependencyResponse forCell = sheetService.dependencies(spreadsheetId, 0, "A1");
        assertEquals(Arrays.asList("B1", "C1"), forCell.getDependents());
        assertTrue(forCell.getPrecedents().isEmpty());

        DependencyResponse forSheet = sheetService.dependencies(spreadsheetId, 0, null);
        assertEquals(Arrays.asList("A1", "A2"), forSheet.getForward().get("B1"));
        assertEquals(Collections.singletonList("A1:A5"), forSheet.getForward().get("C1"));
    }

    /**
     * Writers on separate threads never lose an update and the sum reader sees all of them.
     */
    @Test
    void testConcurrentWriters() throws Exception {
        set("F1", "=SUM(A1:D25)");
        int writers = 4;
        ExecutorService pool = Executors.newFixedThreadPool(writers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        for (int w = 0; w < writers; w++) {
            final int column = w;
            futures.add(pool.submit(() -> {
                start.await();
                for (int row = 0; row < 25; row++) {
                    sheetService.updateCells(spreadsheetId, 0, new UpdateCellsRequest("p" + column,
                            Collections.singletonList(new CellUpdateRequest(row, column, 1))));
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get(30, TimeUnit.SECONDS);
        }
        pool.shutdown();

        assertEquals(CellValue.number(100), valueOf("F1"));
        assertEquals(101, fixture.registry.require(spreadsheetId).getRevision());
    }
}
