package com.example.techsewa.knowledge;

import com.example.techsewa.lang.Languages;
import com.example.techsewa.support.TestKnowledge;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class KnowledgeBaseCodecTest {

    private final KnowledgeBaseCodec codec = TestKnowledge.codec();

    @Test
    void decodesPersistedFormat() {
        List<ProblemRecord> records = codec.decode(TestKnowledge.WIFI_AND_PRINTER);

        ProblemRecord wifi = records.get(0);
        assertThat(wifi.aliasesFor(Languages.EN)).containsExactly("wifi not working", "no internet");
        assertThat(wifi.aliasesFor(Languages.NP)).containsExactly("इन्टरनेट छैन");
        assertThat(wifi.answerFor(Languages.NP)).isEqualTo("राउटर पुनः सुरु गर्नुहोस्।");
        assertThat(wifi.isAutoFix()).isTrue();
        assertThat(wifi.isLearned()).isFalse();

        ProblemRecord printer = records.get(1);
        assertThat(printer.isAutoFix()).isFalse();
        assertThat(printer.answerFor(Languages.NP)).isEqualTo("Open the tray and remove the stuck paper.");
    }

    @Test
    void encodeThenDecodeIsLossless() {
        List<ProblemRecord> records = codec.decode(TestKnowledge.WIFI_AND_PRINTER);

        assertThat(codec.decode(codec.encode(records))).isEqualTo(records);
    }

    @Test
    void missingIdIsDerivedFromFirstAlias() {
        List<ProblemRecord> records = codec.decode("[{\"aliases\": [\"usb not detected\"], \"en\": \"Try another port.\"}]");

        assertThat(records.get(0).getId()).isEqualTo(ProblemIds.forQuery("usb not detected"));
    }
}
