package com.prakash.focusplanner.repository;

import com.prakash.focusplanner.exception.StoreFailureException;
import com.prakash.focusplanner.model.Task;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class MongoTaskStoreTest {

    private TaskRepository taskRepository;
    private MongoTaskStore store;

    @BeforeEach
    void setUp() {
        taskRepository = mock(TaskRepository.class);
        store = new MongoTaskStore(taskRepository);
    }

    @Test
    @DisplayName("fetching no ids skips the round trip")
    void emptyIds() {
        assertTrue(store.fetchByIds(List.of()).isEmpty());
        verifyNoInteractions(taskRepository);
    }

    @Test
    @DisplayName("subtasks come from the ordered finder")
    void fetchByParent() {
        Task sub = Task.builder().id("t-2").parentTaskId("t-1").build();
        when(taskRepository.findByParentTaskIdOrderBySortOrderAsc("t-1")).thenReturn(List.of(sub));

        assertEquals(List.of(sub), store.fetchByParent("t-1"));
    }

    @Test
    @DisplayName("data access errors become store failures")
    void wrapsFailures() {
        doThrow(new DataAccessResourceFailureException("down")).when(taskRepository).deleteById("t-1");

        assertThrows(StoreFailureException.class, () -> store.delete("t-1"));
    }
}
