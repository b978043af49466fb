package io.github.riemr.production.planning.assignment;

import lombok.Value;

import java.util.List;

/**
 * ある日のある工程に就く作業者の組。空の場合は標準作業者 1 名を仮定して所要時間を見積もる。
 */
@Value
public class Crew {
    List<CrewMember> members;

    public static Crew empty() {
        return new Crew(List.of());
    }

    public boolean isEmpty() {
        return members.isEmpty();
    }

    public int size() {
        return members.size();
    }

    /** 1 秒あたりの出来高。timePerPiece は正であること。 */
    public double piecesPerSecond(int timePerPieceSeconds) {
        if (members.isEmpty()) {
            return 1.0 / timePerPieceSeconds;
        }
        double rate = 0;
        for (CrewMember m : members) {
            rate += 1.0 / (timePerPieceSeconds * WorkerAssignmentResolver.timeMultiplier(m.getLevel()));
        }
        return rate;
    }
}
