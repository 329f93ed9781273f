package com.vulcorpus.service;

import com.vulcorpus.model.AugmentScope;
import com.vulcorpus.model.CorpusRow;
import com.vulcorpus.model.DatasetSplits;
import com.vulcorpus.model.IndexedPool;
import com.vulcorpus.model.MaterializedSplits;
import com.vulcorpus.model.RowPool;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 按泄漏策略把合成池合并进真实切分
 *
 * train_only：合成数据只进入 train，val / test 原样保留
 * all：合成数据进入每个存在的切分（评估集会被合成分布污染，需显式开启）
 *
 * 合并后每个切分都会再过滤空代码行、重新规范化，最后分配连续的 0 基 index
 * 合成池的池内去重和对 train 去重叠由调用方在合并前按配置完成
 *
 * @author yHong
 * @version 1.0
 * @since 2025/10/23
 */
@Service
@Slf4j
public class AugmentationMerger {

    private final SchemaNormalizer schemaNormalizer;

    public AugmentationMerger(SchemaNormalizer schemaNormalizer) {
        this.schemaNormalizer = schemaNormalizer;
    }

    public MaterializedSplits merge(DatasetSplits real, RowPool synthetic, AugmentScope scope) {
        return merge(real.train(), real.val().orElse(null), real.test().orElse(null), synthetic, scope);
    }

    /**
     * @param realVal   可为 null
     * @param realTest  可为 null
     * @param synthetic 为 null 表示本次不做增强，train 输出名为 train；否则为 train_aug
     */
    public MaterializedSplits merge(RowPool realTrain, RowPool realVal, RowPool realTest,
                                    RowPool synthetic, AugmentScope scope) {
        String trainName = synthetic == null ? "train" : "train_aug";
        RowPool synth = synthetic == null ? RowPool.empty("synthetic") : synthetic;
        AugmentScope effective = scope == null ? AugmentScope.TRAIN_ONLY : scope;
        if (effective == AugmentScope.ALL && !synth.isEmpty()) {
            log.warn("⚠️ 增强范围为 all，合成数据将进入 val / test，评估结果可能受合成分布影响");
        }

        RowPool train = realTrain.concat(trainName, synth);
        RowPool val = realVal == null ? null : augment(realVal, synth, effective);
        RowPool test = realTest == null ? null : augment(realTest, synth, effective);

        return new MaterializedSplits(
                finish(train),
                val == null ? null : finish(val),
                test == null ? null : finish(test));
    }

    private RowPool augment(RowPool real, RowPool synth, AugmentScope scope) {
        return scope == AugmentScope.ALL ? real.concat(real.name(), synth) : real;
    }

    /**
     * 规范化 -> 过滤空代码 -> 分配 index，index 必须最后分配
     * 先规范化是为了让只含空白的代码在过滤时同样视为空
     */
    private IndexedPool finish(RowPool pool) {
        RowPool normalized = schemaNormalizer.normalize(pool);
        List<CorpusRow> nonEmpty = normalized.rows().stream()
                .filter(CorpusRow::hasCode)
                .collect(Collectors.toList());
        int dropped = normalized.size() - nonEmpty.size();
        if (dropped > 0) {
            log.warn("⚠️ 切分 {} 中有 {} 行代码为空，已丢弃", pool.name(), dropped);
        }
        return IndexedPool.of(new RowPool(pool.name(), nonEmpty));
    }
}
