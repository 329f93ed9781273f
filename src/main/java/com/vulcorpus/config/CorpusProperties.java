package com.vulcorpus.config;

import com.vulcorpus.model.AugmentScope;
import com.vulcorpus.model.SplitRatios;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 语料构建配置，对应 application.yml 中的 corpus.*
 *
 * @author yHong
 * @version 1.0
 * @since 2025/10/24
 */
@Data
@ConfigurationProperties(prefix = "corpus")
public class CorpusProperties {

    /**
     * 应用启动时是否直接执行一次流水线
     */
    private boolean runOnStartup = true;

    /**
     * 输出目录
     */
    private String outputDir = "out";

    /**
     * 合成数据允许进入的切分：train_only | all
     */
    private AugmentScope augmentScope = AugmentScope.TRAIN_ONLY;

    private Primary primary = new Primary();

    private RealSplits realSplits = new RealSplits();

    private Synthetic synthetic = new Synthetic();

    private Split split = new Split();

    /**
     * 原始漏洞-补丁语料（JSONL，每行一个含 details 的源对象）
     */
    @Data
    public static class Primary {
        private String trainJsonl;
        private String valJsonl;
        private String testJsonl;

        /**
         * 单个合并文件，构建后按 split.* 做分层切分
         */
        private String allJsonl;

        /**
         * 只保留该语言的 detail，例如 C 或 C++；为空时不过滤
         */
        private String filterLanguage;

        /**
         * 以 DEBUG 输出前 N 条被跳过 detail 的明细
         */
        private int debugSamples = 0;
    }

    /**
     * 已经转换好的规范 CSV 切分，val / test 未配置时在 train 同目录下查找 val.csv / test.csv
     */
    @Data
    public static class RealSplits {
        private String trainCsv;
        private String valCsv;
        private String testCsv;
    }

    @Data
    public static class Synthetic {
        private String vulnerableCsv;
        private String nonVulnerableCsv;

        /**
         * 只保留 is_complete 为 true 的合成样本（列存在时）
         */
        private boolean keepOnlyComplete = false;

        /**
         * 合成池内按代码指纹去重
         */
        private boolean dedupWithin = false;

        /**
         * 去掉与真实 train 代码指纹相同的合成样本
         */
        private boolean dedupAgainstTrain = false;

        public boolean isConfigured() {
            return hasText(vulnerableCsv) || hasText(nonVulnerableCsv);
        }
    }

    @Data
    public static class Split {
        private long seed = 123456L;
        private double trainRatio = 0.8;
        private double valRatio = 0.1;
        private double testRatio = 0.1;

        public SplitRatios toRatios() {
            return new SplitRatios(trainRatio, valRatio, testRatio);
        }
    }

    static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
