package com.vulcorpus.service;

import com.vulcorpus.model.CorpusRow;
import com.vulcorpus.model.DatasetSplits;
import com.vulcorpus.model.RowPool;
import com.vulcorpus.model.SplitRatios;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.stream.Collectors;

/**
 * 按类别分层、可复现的 train / val / test 切分
 *
 * 正负样本分别用同一个随机数生成器打乱，各自按 floor(n * ratio) 切出 train、val，剩余归 test；
 * 拼接后的三个切分再依次用同一生成器（延续状态）打乱以交错类别
 * 只使用显式传入或由 seed 新建的 Random，不读取任何全局随机状态
 *
 * @author yHong
 * @version 1.0
 * @since 2025/10/23
 */
@Service
@Slf4j
public class StratifiedSplitter {

    public DatasetSplits split(RowPool pool, long seed, SplitRatios ratios) {
        return split(pool, new Random(seed), ratios);
    }

    public DatasetSplits split(RowPool pool, Random random, SplitRatios ratios) {
        List<CorpusRow> positives = pool.rows().stream()
                .filter(CorpusRow::isVulnerable)
                .collect(Collectors.toCollection(ArrayList::new));
        List<CorpusRow> negatives = pool.rows().stream()
                .filter(row -> !row.isVulnerable())
                .collect(Collectors.toCollection(ArrayList::new));
        Collections.shuffle(positives, random);
        Collections.shuffle(negatives, random);

        Bucket pos = Bucket.of(positives, ratios);
        Bucket neg = Bucket.of(negatives, ratios);

        List<CorpusRow> train = concat(pos.train(), neg.train());
        List<CorpusRow> val = concat(pos.val(), neg.val());
        List<CorpusRow> test = concat(pos.test(), neg.test());
        Collections.shuffle(train, random);
        Collections.shuffle(val, random);
        Collections.shuffle(test, random);

        log.info("分层切分完成: 正样本 {} / 负样本 {} -> train={}, val={}, test={}",
                positives.size(), negatives.size(), train.size(), val.size(), test.size());

        return new DatasetSplits(
                new RowPool("train", train),
                new RowPool("val", val),
                new RowPool("test", test));
    }

    private static List<CorpusRow> concat(List<CorpusRow> first, List<CorpusRow> second) {
        List<CorpusRow> merged = new ArrayList<>(first.size() + second.size());
        merged.addAll(first);
        merged.addAll(second);
        return merged;
    }

    /**
     * 单个类别的三段切分
     */
    private record Bucket(List<CorpusRow> train, List<CorpusRow> val, List<CorpusRow> test) {

        static Bucket of(List<CorpusRow> rows, SplitRatios ratios) {
            int n = rows.size();
            int nTrain = (int) Math.floor(n * ratios.train());
            int nVal = Math.min((int) Math.floor(n * ratios.val()), n - nTrain);
            return new Bucket(
                    rows.subList(0, nTrain),
                    rows.subList(nTrain, nTrain + nVal),
                    rows.subList(nTrain + nVal, n));
        }
    }
}
