package com.focus.gate.engine.rules;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

// * Curated domain and URL-pattern tables backing the rule tier.
public final class DomainCatalog {

    // Short-form video markers, only checked on youtube.com hosts.
    public static final List<String> SHORT_FORM_MARKERS = List.of(
            "/shorts",
            "el=shortspage",
            "reel_watch_sequence",
            "reel_item_watch",
            "youtubei/v1/reel");

    // Short-form feeds blocked on any host.
    public static final List<String> SHORT_FORM_PATTERNS = List.of(
            "instagram.com/reels",
            "youtube.com/shorts",
            "tiktok.com");

    // Matched against the domain exactly, or as a substring of the whole URL.
    public static final Set<String> INFRASTRUCTURE = Set.of(
            "googlevideo.com", "ggpht.com", "ytimg.com", "gstatic.com",
            "googleusercontent.com", "googleapis.com", "google.com",
            "youtube.com/api/stats", "youtube.com/videoplayback",
            "youtube.com/get_video_info", "youtube.com/iframe_api",
            "youtube.com/embed", "youtube.com/player", "youtube.com/s/player",
            "youtube.com/feather", "youtube.com/iframe", "youtube.com/static",
            "youtube.com/yt", "youtube.com/accounts", "youtube.com/channel",
            "youtube.com/user", "youtube.com/c", "youtube.com/playlist",
            "youtube.com/results", "youtube.com/search");

    public static final Set<String> EDUCATIONAL = Set.of(
            "github.com", "stackoverflow.com", "wikipedia.org", "docs.python.org",
            "python.org", "realpython.com", "geeksforgeeks.org", "tutorialspoint.com",
            "w3schools.com", "mdn.io", "developer.mozilla.org", "kaggle.com",
            "coursera.org", "edx.org", "udemy.com", "freecodecamp.org",
            "leetcode.com", "hackerrank.com", "codewars.com", "exercism.io",
            "rust-lang.org", "golang.org", "nodejs.org", "reactjs.org",
            "vuejs.org", "angular.io", "djangoproject.com", "flask.palletsprojects.com",
            "fastapi.tiangolo.com", "pytorch.org", "tensorflow.org", "scikit-learn.org",
            "pandas.pydata.org", "numpy.org", "matplotlib.org", "seaborn.pydata.org",
            "plotly.com", "jupyter.org", "anaconda.com", "conda.io");

    public static final Set<String> DISTRACTION = Set.of(
            "facebook.com", "snapchat.com", "reddit.com", "9gag.com", "imgur.com",
            "buzzfeed.com", "vice.com", "vox.com", "huffpost.com",
            "dailymail.co.uk", "thesun.co.uk", "tmz.com", "eonline.com",
            "people.com", "usmagazine.com", "justjared.com", "popsugar.com",
            "refinery29.com", "bustle.com", "cosmopolitan.com", "elle.com",
            "vogue.com", "glamour.com", "seventeen.com", "teenvogue.com",
            "tumblr.com", "deviantart.com", "flickr.com",
            "500px.com", "behance.net", "dribbble.com", "artstation.com");

    // Platform feed pages, matched as URL substrings.
    public static final List<String> FEED_URL_PATTERNS = List.of(
            "instagram.com/explore",
            "x.com/home",
            "x.com/explore",
            "youtube.com/feed",
            "youtube.com/trending");

    // Generic feed paths, matched as URL substrings on any host.
    public static final List<String> FEED_PATH_PATTERNS = List.of(
            "/feed", "/home", "/timeline", "/stories", "/reels", "/shorts");

    public static final List<String> WATCH_EDUCATIONAL_KEYWORDS = List.of(
            "tutorial", "course", "learn", "education", "how to", "guide", "lesson");

    public static final List<String> WATCH_ENDPOINTS = List.of("/watch", "youtubei/v1/player");

    public static final Set<String> SEARCH_ENGINES = Set.of(
            "google.com", "bing.com", "duckduckgo.com", "yahoo.com");

    public static final String VIDEO_PLATFORM = "youtube.com";

    private DomainCatalog() {
    }

    static Set<String> merge(Set<String> curated, List<String> extra) {
        Set<String> merged = new LinkedHashSet<>(curated);
        if (extra != null) {
            extra.stream()
                    .map(d -> d.trim().toLowerCase(Locale.ROOT))
                    .filter(d -> !d.isEmpty())
                    .forEach(merged::add);
        }
        return Set.copyOf(merged);
    }
}
