package com.cred.freestyle.deadpool.service;

import com.cred.freestyle.deadpool.domain.model.Candidate;
import com.cred.freestyle.deadpool.domain.model.DraftOrderEntry;
import com.cred.freestyle.deadpool.domain.model.LeaderboardEntry;
import com.cred.freestyle.deadpool.domain.model.Pick;
import com.cred.freestyle.deadpool.exception.ResourceNotFoundException;
import com.cred.freestyle.deadpool.repository.CandidateRepository;
import com.cred.freestyle.deadpool.repository.PickRepository;
import com.cred.freestyle.deadpool.repository.PlayerRepository;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Scoring engine.
 *
 * A pick scores {@code 50 + (100 - age)} when its candidate died in the scored year and
 * nothing otherwise. The stored age is used as-is; a missing age counts as 0.
 *
 * @author Deadpool Team
 */
@Service
public class ScoringService {

    static final int BASE_POINTS = 50;
    static final int AGE_CEILING = 100;

    private final PlayerRepository playerRepository;
    private final PickRepository pickRepository;
    private final CandidateRepository candidateRepository;
    private final SeasonSnapshotLoader snapshotLoader;

    public ScoringService(PlayerRepository playerRepository,
                          PickRepository pickRepository,
                          CandidateRepository candidateRepository,
                          SeasonSnapshotLoader snapshotLoader) {
        this.playerRepository = playerRepository;
        this.pickRepository = pickRepository;
        this.candidateRepository = candidateRepository;
        this.snapshotLoader = snapshotLoader;
    }

    /**
     * @throws ResourceNotFoundException if the player is unknown
     */
    public int computeScore(String playerId, int year) {
        if (!playerRepository.existsById(playerId)) {
            throw new ResourceNotFoundException("Player", playerId);
        }
        List<Pick> picks = pickRepository.findByPlayerAndYear(playerId, year);
        Map<String, Candidate> candidates = candidateRepository.findAllById(
                picks.stream().map(Pick::getCandidateId).collect(Collectors.toList()));
        int score = 0;
        for (Pick pick : picks) {
            score += scorePick(candidates.get(pick.getCandidateId()), year);
        }
        return score;
    }

    public List<LeaderboardEntry> computeLeaderboard(int year) {
        return computeLeaderboard(snapshotLoader.load(year));
    }

    /**
     * Leaderboard of every player in the season's draft order: score descending,
     * ties by draft position ascending, ranks 1..N.
     */
    public List<LeaderboardEntry> computeLeaderboard(SeasonSnapshot season) {
        List<LeaderboardEntry> entries = new ArrayList<>();
        for (DraftOrderEntry entry : season.getOrder()) {
            int score = 0;
            for (Pick pick : season.getPicks(entry.getPlayerId())) {
                score += scorePick(season.getCandidate(pick.getCandidateId()), season.getYear());
            }
            entries.add(LeaderboardEntry.builder()
                    .playerId(entry.getPlayerId())
                    .playerName(season.getPlayerName(entry.getPlayerId()))
                    .score(score)
                    .draftPosition(entry.getPosition())
                    .build());
        }

        entries.sort(Comparator.comparingInt(LeaderboardEntry::getScore).reversed()
                .thenComparingInt(LeaderboardEntry::getDraftPosition));
        for (int i = 0; i < entries.size(); i++) {
            entries.get(i).setRank(i + 1);
        }
        return entries;
    }

    /**
     * Points for one pick in the given year.
     */
    public static int scorePick(Candidate candidate, int year) {
        if (candidate == null || !candidate.diedIn(year)) {
            return 0;
        }
        int age = candidate.getAge() == null ? 0 : candidate.getAge();
        return BASE_POINTS + (AGE_CEILING - age);
    }
}
