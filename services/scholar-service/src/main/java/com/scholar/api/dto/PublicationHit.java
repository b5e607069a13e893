package com.scholar.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.scholar.corpus.Author;
import com.scholar.search.RankedDocument;
import java.util.ArrayList;
import java.util.List;

public class PublicationHit {
    private String title;
    private String link;
    private List<AuthorView> authors;

    @JsonProperty("published_date")
    private String publishedDate;

    @JsonProperty("abstract")
    private String abstractText;

    private double score;

    public static PublicationHit from(RankedDocument ranked) {
        PublicationHit hit = new PublicationHit();
        hit.setTitle(ranked.record().title());
        hit.setLink(ranked.record().link());
        List<AuthorView> authors = new ArrayList<>();
        for (Author author : ranked.record().authors()) {
            authors.add(new AuthorView(author.name(), author.profile()));
        }
        hit.setAuthors(authors);
        hit.setPublishedDate(ranked.record().publishedDate());
        hit.setAbstractText(ranked.record().abstractText());
        hit.setScore(ranked.score());
        return hit;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getLink() {
        return link;
    }

    public void setLink(String link) {
        this.link = link;
    }

    public List<AuthorView> getAuthors() {
        return authors;
    }

    public void setAuthors(List<AuthorView> authors) {
        this.authors = authors;
    }

    public String getPublishedDate() {
        return publishedDate;
    }

    public void setPublishedDate(String publishedDate) {
        this.publishedDate = publishedDate;
    }

    public String getAbstractText() {
        return abstractText;
    }

    public void setAbstractText(String abstractText) {
        this.abstractText = abstractText;
    }

    public double getScore() {
        return score;
    }

    public void setScore(double score) {
        this.score = score;
    }

    public static class AuthorView {
        private String name;
        private String profile;

        public AuthorView() {
        }

        public AuthorView(String name, String profile) {
            this.name = name;
            this.profile = profile;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getProfile() {
            return profile;
        }

        public void setProfile(String profile) {
            this.profile = profile;
        }
    }
}
