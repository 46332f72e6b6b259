package com.safeher.sosdispatch.service;

import com.safeher.sosdispatch.entity.Volunteer;
import com.safeher.sosdispatch.entity.VolunteerBadge;
import com.safeher.sosdispatch.repository.VolunteerRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Running volunteer statistics and badge awards.
 *
 * Averages are updated incrementally against their own sample count:
 *   avgResponseTime = (avg × (n − 1) + sample) / n,  n = totalResponses after increment
 *   avgRating       = (avg × (c − 1) + rating) / c,  c = ratingCount after increment
 *
 * Callers pass a volunteer that is managed in the current transaction.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReputationService {

    private final VolunteerRepository volunteerRepository;
    private final Clock clock;

    /**
     * Credits a volunteer-attributed resolution.
     *
     * @param responseTimeSeconds acceptedAt − createdAt of the resolved alert
     * @param rating              1–5, or null when the resolver gave none
     * @return names of badges newly awarded by this call
     */
    public List<String> recordSuccessfulResponse(Volunteer volunteer, Long responseTimeSeconds, Integer rating) {
        int n = volunteer.getTotalResponses() + 1;
        volunteer.setTotalResponses(n);
        volunteer.setSuccessfulAssists(volunteer.getSuccessfulAssists() + 1);

        long sample = responseTimeSeconds != null ? Math.max(0, responseTimeSeconds) : 0;
        volunteer.setAvgResponseTimeSeconds(
                (volunteer.getAvgResponseTimeSeconds() * (n - 1) + sample) / n);

        if (rating != null) {
            addRatingSample(volunteer, rating);
        }

        List<String> awarded = evaluateBadges(volunteer);
        volunteerRepository.save(volunteer);

        log.info("REPUTATION: volunteer #{} — responses={}, assists={}, avgResponse={}s, avgRating={} ({} ratings){}",
                volunteer.getId(), volunteer.getTotalResponses(), volunteer.getSuccessfulAssists(),
                String.format("%.1f", volunteer.getAvgResponseTimeSeconds()),
                String.format("%.2f", volunteer.getAvgRating()), volunteer.getRatingCount(),
                awarded.isEmpty() ? "" : ", new badges " + awarded);
        return awarded;
    }

    /**
     * Folds an owner-supplied feedback rating into the responder's average.
     *
     * @param previousRating rating already counted for this alert, or null. When present it is
     *                       replaced in place and the rating count does not change.
     */
    public void applyFeedbackRating(Volunteer volunteer, int newRating, Integer previousRating) {
        int count = volunteer.getRatingCount();
        if (previousRating != null && count > 0) {
            volunteer.setAvgRating((volunteer.getAvgRating() * count - previousRating + newRating) / count);
        } else {
            addRatingSample(volunteer, newRating);
        }
        volunteerRepository.save(volunteer);
        log.info("REPUTATION: volunteer #{} rating folded in — avgRating={} over {} rating(s)",
                volunteer.getId(), String.format("%.2f", volunteer.getAvgRating()), volunteer.getRatingCount());
    }

    /**
     * Awards every badge the volunteer now qualifies for and does not hold yet.
     * Calling it again without a stats change awards nothing.
     */
    public List<String> evaluateBadges(Volunteer volunteer) {
        List<String> awarded = new ArrayList<>();
        LocalDateTime now = LocalDateTime.now(clock);
        for (BadgeRule rule : BadgeRule.values()) {
            if (rule.isEarnedBy(volunteer) && !volunteer.hasBadge(rule.getBadgeName())) {
                volunteer.getBadges().add(VolunteerBadge.builder()
                        .volunteer(volunteer)
                        .name(rule.getBadgeName())
                        .earnedAt(now)
                        .build());
                awarded.add(rule.getBadgeName());
            }
        }
        return awarded;
    }

    private void addRatingSample(Volunteer volunteer, int rating) {
        int c = volunteer.getRatingCount() + 1;
        volunteer.setRatingCount(c);
        volunteer.setAvgRating((volunteer.getAvgRating() * (c - 1) + rating) / c);
    }
}
