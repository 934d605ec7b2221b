package com.splitttr.formcollab.session;

import com.splitttr.formcollab.support.TestConfig;
import org.junit.jupiter.api.Test;

import static org.mockito.Mockito.*;

class IdleReaperTest {

    @Test
    void sweep_delegatesToRegistry() {
        var reaper = new IdleReaper();
        reaper.roomRegistry = mock(RoomRegistry.class);
        reaper.config = new TestConfig();
        when(reaper.roomRegistry.evictIdle()).thenReturn(2);

        reaper.sweep();
        reaper.sweep();

        verify(reaper.roomRegistry, times(2)).evictIdle();
    }
}
