package com.tablesearch.index;

import com.tablesearch.config.Constants;
import com.tablesearch.storage.CorruptStorageException;
import com.tablesearch.storage.DictionaryReader;
import com.tablesearch.storage.DictionaryWriter;
import com.tablesearch.storage.IndexMeta;
import com.tablesearch.storage.IndexNotFoundException;
import com.tablesearch.storage.PostingList;
import com.tablesearch.storage.PostingsReader;
import com.tablesearch.storage.PostingsWriter;
import com.tablesearch.storage.TermDirectory;
import com.tablesearch.storage.TermEntry;
import com.tablesearch.text.Tokenizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.OptionalLong;

/**
 * 磁盘倒排索引：一个目录对应一个倒排数据文件、一个词项偏移目录、一个词典和一份 JSON 元数据。
 *
 * 打开时只加载元数据，倒排数据按需按区间读取。
 */
public final class InvertedIndex {
    private static final Logger logger = LoggerFactory.getLogger(InvertedIndex.class);

    private final Path indexDir;
    private final IndexMeta meta;
    private final TermDirectory directory;
    private final DictionaryReader dictionary;
    private final PostingsReader postingsReader;

    private InvertedIndex(Path indexDir, IndexMeta meta, TermDirectory directory, DictionaryReader dictionary) {
        this.indexDir = indexDir;
        this.meta = meta;
        this.directory = directory;
        this.dictionary = dictionary;
        this.postingsReader = new PostingsReader(indexDir.resolve(Constants.POSTINGS_FILE), meta.postingsBytes());
    }

    /**
     * 对文档序列分词、建词表并落盘。
     *
     * @param documents 按 docId 排列的文档文本
     * @param indexDir 索引目录，不存在时创建
     * @param tokenizer 分词器，查询时必须使用同一实现
     * @return 已打开的索引
     * @throws IOException 写入失败时抛出
     */
    public static InvertedIndex index(List<String> documents, Path indexDir, Tokenizer tokenizer) throws IOException {
        Vocabulary vocabulary = new VocabularyBuilder(tokenizer).build(documents);
        PostingsLayout layout = PostingsLayoutBuilder.build(vocabulary.postings());
        return build(vocabulary, layout, indexDir);
    }

    /**
     * 按布局写出倒排数据、偏移目录、词典与元数据。元数据最后写入，作为索引完整的标志。
     *
     * @param vocabulary 词表与频次
     * @param layout 分组后的倒排布局，可为过滤后的非连续布局
     * @param indexDir 索引目录，不存在时创建
     * @return 已打开的索引
     * @throws IOException 写入失败时抛出
     */
    public static InvertedIndex build(Vocabulary vocabulary, PostingsLayout layout, Path indexDir) throws IOException {
        if (vocabulary == null || layout == null || indexDir == null) {
            throw new IllegalArgumentException("vocabulary、layout 与 indexDir 不能为空");
        }
        long startNanos = System.nanoTime();
        Files.createDirectories(indexDir);
        Files.deleteIfExists(indexDir.resolve(Constants.INDEX_META_FILE));

        Path postingsFile = indexDir.resolve(Constants.POSTINGS_FILE);
        int[] sortedTermIds = layout.sortedTermIds();
        long[] offsets = new long[sortedTermIds.length];
        long postingsBytes;
        try (PostingsWriter writer = new PostingsWriter(postingsFile)) {
            for (int slot = 0; slot < sortedTermIds.length; slot++) {
                offsets[slot] = writer.writePostingList(sortedTermIds[slot], layout.postingsFor(sortedTermIds[slot]));
            }
            postingsBytes = writer.length();
        }

        TermDirectory directory = new TermDirectory(sortedTermIds, offsets);
        directory.writeTo(indexDir.resolve(Constants.DIRECTORY_FILE));

        try (DictionaryWriter writer = new DictionaryWriter(indexDir.resolve(Constants.DICTIONARY_FILE))) {
            for (Map.Entry<String, Integer> termId : vocabulary.termIds().entrySet()) {
                int id = termId.getValue();
                writer.writeTermEntry(new TermEntry(termId.getKey(), id,
                    vocabulary.docFreqs().getOrDefault(id, 0), vocabulary.wordFreqs().getOrDefault(id, 0)));
            }
        }

        IndexMeta meta = new IndexMeta(Constants.FORMAT_VERSION, vocabulary.docCount(), vocabulary.size(),
            directory.size(), postingsBytes, IndexMeta.crc32Of(postingsFile), Instant.now());
        meta.writeTo(indexDir.resolve(Constants.INDEX_META_FILE));

        long elapsedMs = (System.nanoTime() - startNanos) / 1_000_000;
        logger.info("倒排索引已写入: dir={}, docs={}, terms={}, postingsBytes={}, elapsedMs={}",
            indexDir, vocabulary.docCount(), vocabulary.size(), postingsBytes, elapsedMs);
        return open(indexDir);
    }

    /**
     * 打开已有索引，只加载目录、词典与元数据，不读取倒排数据。
     *
     * @param indexDir 索引目录
     * @return 已打开的索引
     * @throws IndexNotFoundException 目录或任一必需文件缺失时抛出
     * @throws IOException 元数据损坏时抛出
     */
    public static InvertedIndex open(Path indexDir) throws IOException {
        if (indexDir == null) {
            throw new IllegalArgumentException("索引目录不能为空");
        }
        if (!Files.isDirectory(indexDir)) {
            throw new IndexNotFoundException("索引目录不存在，是否尚未建立索引", indexDir);
        }
        for (String requiredFile : List.of(Constants.INDEX_META_FILE, Constants.DIRECTORY_FILE,
                Constants.DICTIONARY_FILE, Constants.POSTINGS_FILE)) {
            Path required = indexDir.resolve(requiredFile);
            if (!Files.isRegularFile(required)) {
                throw new IndexNotFoundException("索引文件缺失", required);
            }
        }

        IndexMeta meta = IndexMeta.readFrom(indexDir.resolve(Constants.INDEX_META_FILE));
        if (meta.formatVersion() != Constants.FORMAT_VERSION) {
            throw new CorruptStorageException("索引格式版本不支持: " + meta.formatVersion());
        }
        TermDirectory directory = TermDirectory.readFrom(indexDir.resolve(Constants.DIRECTORY_FILE));
        DictionaryReader dictionary = new DictionaryReader(indexDir.resolve(Constants.DICTIONARY_FILE));
        if (directory.size() != meta.directorySize() || dictionary.getTermCount() != meta.termCount()) {
            throw new CorruptStorageException("索引元数据与目录/词典不一致: dir=" + indexDir
                + ", directory=" + directory.size() + "/" + meta.directorySize()
                + ", terms=" + dictionary.getTermCount() + "/" + meta.termCount());
        }
        logger.debug("打开倒排索引: dir={}, terms={}, directory={}", indexDir, meta.termCount(), directory.size());
        return new InvertedIndex(indexDir, meta, directory, dictionary);
    }

    /**
     * 按词项ID读取倒排列表；目录中不存在时返回空列表。
     *
     * @param termId 词项ID
     * @return 倒排列表
     * @throws IOException 读取失败或数据损坏时抛出
     */
    public PostingList lookup(int termId) throws IOException {
        OptionalLong startOffset = directory.startOffset(termId);
        if (startOffset.isEmpty()) {
            return PostingList.empty(termId);
        }
        long endOffset = directory.endOffset(termId, meta.postingsBytes()).getAsLong();
        return postingsReader.readPostingList(termId, startOffset.getAsLong(), endOffset);
    }

    /**
     * 按词项文本读取倒排列表；不在词表中时返回空列表。
     */
    public PostingList lookupByText(String term) throws IOException {
        OptionalInt termId = termId(term);
        if (termId.isEmpty()) {
            return PostingList.empty(-1);
        }
        return lookup(termId.getAsInt());
    }

    public OptionalInt termId(String term) {
        if (term == null) {
            return OptionalInt.empty();
        }
        Optional<TermEntry> entry = dictionary.lookup(term);
        return entry.isPresent() ? OptionalInt.of(entry.get().termId()) : OptionalInt.empty();
    }

    public Optional<TermEntry> termEntry(String term) {
        return term == null ? Optional.empty() : dictionary.lookup(term);
    }

    /**
     * 词项到ID映射，按ID升序。
     */
    public Map<String, Integer> termIds() {
        Map<String, Integer> termIds = new LinkedHashMap<>();
        for (TermEntry entry : dictionary.entries()) {
            termIds.put(entry.term(), entry.termId());
        }
        return termIds;
    }

    public Map<Integer, Integer> docFreqs() {
        Map<Integer, Integer> docFreqs = new LinkedHashMap<>();
        for (TermEntry entry : dictionary.entries()) {
            docFreqs.put(entry.termId(), entry.docFreq());
        }
        return docFreqs;
    }

    public Map<Integer, Integer> wordFreqs() {
        Map<Integer, Integer> wordFreqs = new LinkedHashMap<>();
        for (TermEntry entry : dictionary.entries()) {
            wordFreqs.put(entry.termId(), entry.wordFreq());
        }
        return wordFreqs;
    }

    /**
     * 重新计算倒排文件 CRC32 并与元数据比对。
     *
     * @throws IOException 校验失败时抛出 {@link CorruptStorageException}
     */
    public void verify() throws IOException {
        meta.verifyPostings(indexDir.resolve(Constants.POSTINGS_FILE));
    }

    public int vocabularySize() {
        return dictionary.getTermCount();
    }

    public int docCount() {
        return meta.docCount();
    }

    public TermDirectory directory() {
        return directory;
    }

    public IndexMeta meta() {
        return meta;
    }

    public Path indexDir() {
        return indexDir;
    }

    @Override
    public String toString() {
        return "InvertedIndex(n_vocab=" + vocabularySize() + ", n_docs=" + docCount() + ", dir=" + indexDir + ")";
    }
}
