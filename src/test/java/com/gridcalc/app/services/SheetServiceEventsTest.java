package com.gridcalc.app.services;

import com.gridcalc.app.dto.CellUpdateRequest;
import com.gridcalc.app.dto.UpdateCellsRequest;
import com.gridcalc.app.exceptions.FormulaParseException;
import com.gridcalc.app.models.CellUpdateEvent;
import com.gridcalc.app.models.CellValue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * What SheetService hands to the collaboration layer after an edit.
 */
@ExtendWith(MockitoExtension.class)
class SheetServiceEventsTest {

    @Mock
    private CollaborationService collaborationService;

    @Captor
    private ArgumentCaptor<List<CellUpdateEvent>> eventsCaptor;

    private EngineFixture fixture;
    private String spreadsheetId;

    @BeforeEach
    void setUp() {
        fixture = new EngineFixture(collaborationService);
        spreadsheetId = fixture.newSpreadsheet();
    }

    @Test
    void testEditedAndRecomputedCellsArePublished() {
        fixture.sheetService.setCell(spreadsheetId, 0, "B1", "=A1+1", "p1");
        fixture.sheetService.setCell(spreadsheetId, 0, "A1", 41, "p2");

        verify(collaborationService, times(2)).publish(eq(spreadsheetId), eventsCaptor.capture());
        List<CellUpdateEvent> events = eventsCaptor.getAllValues().get(1);
        assertEquals(2, events.size());
        assertEquals("A1", events.get(0).getAddress());
        assertEquals("B1", events.get(1).getAddress());
        assertEquals(CellValue.number(42), events.get(1).getValue());
        assertEquals("p2", events.get(1).getEditorParticipantId());
        assertEquals(2, events.get(0).getRevision());
    }

    @Test
    void testOverwrittenEditorIsNamed() {
        fixture.sheetService.setCell(spreadsheetId, 0, "A1", "mine", "p1");
        CellUpdateRequest stale = new CellUpdateRequest("A1", "theirs");
        stale.setBaseRevision(0L);
        fixture.sheetService.updateCells(spreadsheetId, 0,
                new UpdateCellsRequest("p2", Collections.singletonList(stale)));

        verify(collaborationService, times(2)).publish(eq(spreadsheetId), eventsCaptor.capture());
        CellUpdateEvent event = eventsCaptor.getAllValues().get(1).get(0);
        assertTrue(event.isConflict());
        assertEquals("p1", event.getOverwrittenParticipantId());
    }

    @Test
    void testRejectedBatchPublishesNothing() {
        assertThrows(FormulaParseException.class, () ->
                fixture.sheetService.setCell(spreadsheetId, 0, "A1", "=SUM(", "p1"));
        verify(collaborationService, never()).publish(any(), any());
    }
}
