package com.ai.salon.service;

import com.ai.salon.entity.HelpRequest;
import com.ai.salon.entity.HelpRequestStatus;
import com.ai.salon.exception.DependencyUnavailableException;
import com.ai.salon.exception.HelpRequestConflictException;
import com.ai.salon.repository.HelpRequestRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;

import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class HelpRequestServiceStoreFailureTest {

    @Mock
    private HelpRequestRepository repository;

    @Mock
    private NotificationOutboxService outbox;

    private HelpRequestService service;

    @BeforeEach
    void setUp() {
        service = new HelpRequestService(repository, outbox);
    }

    private static HelpRequest pending() {
        return HelpRequest.builder()
                .id("req-1")
                .question("Do you accept crypto?")
                .roomName("room-1")
                .status(HelpRequestStatus.PENDING)
                .createdAt(Instant.now())
                .build();
    }

    @Test
    void unreachableStoreOnOpenIsDependencyUnavailable() {
        when(repository.saveAndFlush(any(HelpRequest.class))).thenThrow(new DataAccessResourceFailureException("db down"));

        assertThatThrownBy(() -> service.open("Do you accept crypto?", "room-1", "{}"))
                .isInstanceOf(DependencyUnavailableException.class)
                .hasCauseInstanceOf(DataAccessResourceFailureException.class);
        verifyNoInteractions(outbox);
    }

    @Test
    void timeoutOnResolveIsDependencyUnavailable() {
        when(repository.findById("req-1")).thenReturn(Optional.of(pending()));
        when(repository.saveAndFlush(any(HelpRequest.class))).thenThrow(new QueryTimeoutException("statement timeout"));

        assertThatThrownBy(() -> service.markResolved("req-1", "Yes.", null))
                .isInstanceOf(DependencyUnavailableException.class);
        verifyNoInteractions(outbox);
    }

    @Test
    void racingResolutionIsStillAConflict() {
        when(repository.findById("req-1")).thenReturn(Optional.of(pending()));
        when(repository.saveAndFlush(any(HelpRequest.class)))
                .thenThrow(new ObjectOptimisticLockingFailureException(HelpRequest.class, "req-1"));

        assertThatThrownBy(() -> service.markResolved("req-1", "Yes.", null))
                .isInstanceOf(HelpRequestConflictException.class);
    }
}
