package com.example.techsewa.web;

/**
 * One search result reduced to what the help desk shows.
 */
public record SearchSnippet(String title, String excerpt, String link) {

    public String format() {
        return "🔎 " + title + "\n📝 " + excerpt + "\n🔗 " + link;
    }
}
