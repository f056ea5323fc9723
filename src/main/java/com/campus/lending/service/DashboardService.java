package com.campus.lending.service;

import com.campus.lending.dto.response.DashboardResponse;
import com.campus.lending.entity.ReservationStatus;
import com.campus.lending.entity.TicketStatus;
import com.campus.lending.entity.User;
import com.campus.lending.exception.ResourceNotFoundException;
import com.campus.lending.mapper.UserMapper;
import com.campus.lending.repository.LoanRepository;
import com.campus.lending.repository.ReservationRepository;
import com.campus.lending.repository.ServiceTicketRepository;
import com.campus.lending.repository.UserRepository;
import com.campus.lending.security.Actor;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Landing-page summary. Staff get workload counters across all users, everyone else
 * counters for their own reservations and tickets.
 */
@Service
@RequiredArgsConstructor
public class DashboardService {

    private final UserRepository userRepository;
    private final ReservationRepository reservationRepository;
    private final LoanRepository loanRepository;
    private final ServiceTicketRepository ticketRepository;
    private final Clock clock;

    @Transactional(readOnly = true)
    public DashboardResponse dashboard(Actor actor) {
        User user = userRepository.findById(actor.userId())
            .orElseThrow(() -> new ResourceNotFoundException("User", actor.userId()));

        Map<String, Long> counters = new LinkedHashMap<>();
        if (actor.isStaff()) {
            counters.put("pendingReservations", reservationRepository.countByStatus(ReservationStatus.PENDING));
            counters.put("outstandingLoans", loanRepository.countByReturnedAtIsNull());
            counters.put("overdueLoans", loanRepository.countOverdue(LocalDateTime.now(clock)));
            counters.put("openTickets", ticketRepository.countByStatusNot(TicketStatus.CLOSED));
        } else {
            counters.put("pendingReservations",
                reservationRepository.countByUserIdAndStatus(actor.userId(), ReservationStatus.PENDING));
            counters.put("approvedReservations",
                reservationRepository.countByUserIdAndStatus(actor.userId(), ReservationStatus.APPROVED));
            counters.put("openTickets",
                ticketRepository.countByOpenedByIdAndStatusNot(actor.userId(), TicketStatus.CLOSED));
        }
        return new DashboardResponse(UserMapper.toResponse(user), counters);
    }
}
