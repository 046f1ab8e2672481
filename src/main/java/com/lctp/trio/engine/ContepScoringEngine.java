package com.lctp.trio.engine;

import com.lctp.trio.config.ContepProperties;
import com.lctp.trio.entity.Competitor;
import com.lctp.trio.entity.RunResult;
import com.lctp.trio.entity.Trio;
import com.lctp.trio.enums.CategoryType;
import com.lctp.trio.exception.InvalidPlacementException;
import com.lctp.trio.model.ScoreRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * Converts placements and prize money into CONTEP championship points.
 * Pure function of its inputs: scoring the same ranking twice yields the same records.
 */
@Slf4j
@Component
public class ContepScoringEngine {

    private static final int POINT_SCALE = 2;

    private final PointTable pointTable;
    private final BigDecimal prizePointValue;
    private final BigDecimal prizeShares;

    public ContepScoringEngine(PointTable pointTable, ContepProperties properties) {
        this.pointTable = pointTable;
        this.prizePointValue = properties.getPrizePointValue();
        this.prizeShares = BigDecimal.valueOf(properties.getPrizeShares());
    }

    /**
     * Points for a placement within a field of {@code fieldSize} entries.
     *
     * @throws InvalidPlacementException when placement is outside 1..fieldSize
     */
    public BigDecimal score(int placement, int fieldSize, CategoryType categoryType) {
        if (fieldSize < 1) {
            throw new InvalidPlacementException("Field size must be positive, got " + fieldSize);
        }
        if (placement < 1 || placement > fieldSize) {
            throw new InvalidPlacementException(
                    String.format("Placement %d outside field of %d entries", placement, fieldSize));
        }
        return pointTable.pointsFor(placement, fieldSize, categoryType).setScale(POINT_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Scores an already ranked event/category. Every trio member receives the trio's
     * placement points plus a share of the net prize. No-time and disqualified entries
     * keep their placement but earn no placement points. They still count towards the
     * field size, so the curve is looked up against every ranked entry.
     */
    public List<ScoreRecord> scoreAll(List<RunResult> ranked) {
        if (ranked == null || ranked.isEmpty()) {
            return List.of();
        }
        int fieldSize = ranked.size();
        List<ScoreRecord> records = new ArrayList<>(fieldSize * Trio.SIZE);

        for (RunResult result : ranked) {
            if (result.getPlacement() == null) {
                throw new InvalidPlacementException("Result " + result.getId() + " has no placement");
            }
            Trio trio = result.getTrio();
            CategoryType type = trio.getCategory().getType();

            BigDecimal placementPoints = score(result.getPlacement(), fieldSize, type);
            if (!result.isTimed()) {
                placementPoints = BigDecimal.ZERO.setScale(POINT_SCALE);
            }
            BigDecimal prizeShare = prizeShareOf(result);
            BigDecimal prizePoints = prizeShare.divide(prizePointValue, POINT_SCALE, RoundingMode.HALF_UP);

            for (Competitor member : trio.getMembers()) {
                records.add(ScoreRecord.builder()
                        .competitorId(member.getId())
                        .trioId(trio.getId())
                        .resultId(result.getId())
                        .eventId(result.getProva().getId())
                        .categoryId(trio.getCategory().getId())
                        .placement(result.getPlacement())
                        .fieldSize(fieldSize)
                        .placementPoints(placementPoints)
                        .prizePoints(prizePoints)
                        .prizeShare(prizeShare)
                        .totalPoints(placementPoints.add(prizePoints))
                        .build());
            }
        }

        log.debug("Scored {} results into {} competitor records", fieldSize, records.size());
        return records;
    }

    private BigDecimal prizeShareOf(RunResult result) {
        BigDecimal net = result.getNetPrizeAmount();
        if (net == null || net.signum() <= 0) {
            return BigDecimal.ZERO.setScale(POINT_SCALE);
        }
        return net.divide(prizeShares, POINT_SCALE, RoundingMode.HALF_UP);
    }
}
