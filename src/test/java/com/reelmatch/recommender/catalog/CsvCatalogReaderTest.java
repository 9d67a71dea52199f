package com.reelmatch.recommender.catalog;

import com.reelmatch.recommender.exception.CatalogDataException;
import com.reelmatch.recommender.model.MovieRecord;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.core.io.ClassPathResource;

import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CsvCatalogReaderTest {

    private final CsvCatalogReader reader = new CsvCatalogReader();

    @Test
    void shouldReadHeaderAndRows() throws IOException {
        RawTable table = reader.read(new StringReader("""
            title,overview,genres,vote_average,vote_count,popularity
            Heat,"Thieves, cops and one last job","[""Crime""]",7.7,1886,17.9
            """));

        assertThat(table.columns()).containsExactlyElementsOf(Catalog.REQUIRED_COLUMNS);
        assertThat(table.rows()).hasSize(1);
        assertThat(table.rows().get(0).get("overview")).isEqualTo("Thieves, cops and one last job");
        assertThat(table.rows().get(0).get("genres")).isEqualTo("[\"Crime\"]");
    }

    @Test
    void shouldLoadFixtureIntoCatalog() {
        RawTable table = reader.read(new ClassPathResource("fixtures/movies.csv"));

        Catalog catalog = Catalog.load(table);

        assertThat(catalog.movies()).extracting(MovieRecord::title)
            .containsExactly("Alien", "Aliens", "Paddington", "Amelie");
        assertThat(catalog.get(0).genres()).containsExactly("Horror", "Science Fiction");
        assertThat(catalog.get(2).genres()).containsExactly("Comedy", "Family");
        assertThat(catalog.get(2).popularity()).isZero();
        assertThat(catalog.get(3).voteCount()).isZero();
    }

    @Test
    void shouldFailForMissingFile() {
        assertThatThrownBy(() -> reader.read(new ClassPathResource("fixtures/does-not-exist.csv")))
            .isInstanceOf(CatalogDataException.class)
            .hasMessageContaining("not found");
    }

    @Test
    void shouldReportMissingColumnsThroughCatalog() throws IOException {
        RawTable table = reader.read(new StringReader("name,plot\nHeat,Heist\n"));

        assertThatThrownBy(() -> Catalog.load(table))
            .isInstanceOf(CatalogDataException.class)
            .hasMessageContaining("title");
    }

    @Test
    void shouldIgnoreByteOrderMarkInFile() {
        String csv = "\uFEFFtitle,overview,genres,vote_average,vote_count,popularity\n"
            + "Heat,Thieves and cops,\"[\"\"Crime\"\"]\",7.7,1886,17.9\n";
        RawTable table = reader.read(new ByteArrayResource(csv.getBytes(StandardCharsets.UTF_8)));

        assertThat(table.columns()).containsExactlyElementsOf(Catalog.REQUIRED_COLUMNS);
        Catalog catalog = Catalog.load(table);
        assertThat(catalog.get(0).title()).isEqualTo("Heat");
        assertThat(catalog.get(0).genres()).containsExactly("Crime");
    }

    @Test
    void shouldIgnoreByteOrderMarkInText() throws IOException {
        RawTable table = reader.read(new StringReader("\uFEFFtitle,overview\nHeat,Heist\n"));

        assertThat(table.columns()).containsExactly("title", "overview");
        assertThat(table.rows().get(0)).containsEntry("title", "Heat");
    }
}
