package com.vulcorpus.workflow.dispatcher;

import com.vulcorpus.config.CorpusProperties;
import com.vulcorpus.exception.InvalidConfigException;
import com.vulcorpus.model.InputMode;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * 根据配置决定真实语料从哪里来，配置缺失或互相矛盾时直接失败
 *
 * @author yHong
 * @version 1.0
 * @since 2025/10/24
 */
public class InputModeDispatcher {

    public InputMode dispatch(CorpusProperties properties) {
        CorpusProperties.Primary primary = properties.getPrimary();
        CorpusProperties.RealSplits realSplits = properties.getRealSplits();

        long perSplit = Stream.of(primary.getTrainJsonl(), primary.getValJsonl(), primary.getTestJsonl())
                .filter(InputModeDispatcher::hasText)
                .count();
        boolean combined = hasText(primary.getAllJsonl());
        boolean canonical = hasText(realSplits.getTrainCsv());

        if (perSplit > 0 && perSplit < 3) {
            throw new InvalidConfigException("按切分提供 JSONL 时必须同时配置 train-jsonl、val-jsonl、test-jsonl");
        }
        if (!canonical && (hasText(realSplits.getValCsv()) || hasText(realSplits.getTestCsv()))) {
            throw new InvalidConfigException("配置了 real-splits 的 val / test，但缺少 train-csv");
        }

        List<InputMode> modes = new ArrayList<>();
        if (perSplit == 3) {
            modes.add(InputMode.PER_SPLIT_JSONL);
        }
        if (combined) {
            modes.add(InputMode.COMBINED_JSONL);
        }
        if (canonical) {
            modes.add(InputMode.CANONICAL_CSV);
        }

        if (modes.isEmpty()) {
            throw new InvalidConfigException(
                    "请提供 (train/val/test JSONL)、all-jsonl 或 real-splits.train-csv 中的一种");
        }
        if (modes.size() > 1) {
            throw new InvalidConfigException("输入配置互相矛盾，同时配置了: " + modes);
        }
        return modes.get(0);
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
