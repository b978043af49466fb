package io.github.riemr.production.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * スケジューリングエンジン設定。接頭辞は production.scheduling。
 */
@Data
@ConfigurationProperties(prefix = "production.scheduling")
public class SchedulingProperties {

    /** 1 エントリに割り当てる作業者の上限 */
    private int maxWorkersPerEntry = 3;

    /** 縫製スキルの作業者を縫製以外の工程にも割り当てるか */
    private boolean sewingWorkersAssistOtherSteps = false;

    /** 生成処理のタイムアウト（呼び出し側で未指定の場合） */
    private Duration generationTimeout = Duration.ofSeconds(30);

    /** 開始日未指定時、現在時刻をこの分単位に切り上げて開始する */
    private int replanSlotMinutes = 15;

    private Efficiency efficiency = new Efficiency();

    /** 実績効率による習熟度自動調整のしきい値 */
    @Data
    public static class Efficiency {
        private double highThreshold = 120.0;
        private double lowThreshold = 80.0;
        private int windowSize = 10;
        private int minSamples = 5;
        private int lookbackDays = 30;
    }
}
