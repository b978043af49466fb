package io.github.riemr.production.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** エントリへの作業者割当と、その作業者の計画出来高。 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Assignment {
    private Long entryId;
    private Long workerId;
    private Integer plannedOutput;
}
