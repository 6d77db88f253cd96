package de.bsommerfeld.wsbg.archive.core.util;

import de.bsommerfeld.wsbg.archive.core.domain.ArchiveComment;
import de.bsommerfeld.wsbg.archive.core.domain.ArchivePost;

import java.util.Objects;
import java.util.Random;

/**
 * Produces synthetic archive records for TEST mode and offline development.
 *
 * <p>
 * Output is <strong>deterministic</strong>: the same subreddit and index
 * always yield the same record. A TEST-mode run that is interrupted and
 * resumed therefore sees exactly the data an uninterrupted run would have
 * seen, which is what the resume logic expects from the real archive.
 *
 * <h3>What the output looks like</h3>
 * <ul>
 * <li><strong>Posts</strong>: three-part titles (ticker + sentiment +
 * qualifier), scores 0–5000, upvote ratios 0.60–0.99, 0–500 comments</li>
 * <li><strong>Comments</strong>: short WSB-style one-liners attached to one
 * of a handful of synthetic submissions; scores −50 to +450</li>
 * </ul>
 */
public final class TestDataGenerator {

    private static final String[] TITLES_PART_1 = { "GME", "AMC", "NVIDIA", "Tesla", "Bitcoin", "Rheinmetall",
            "MicroStrategy", "Palantir" };
    private static final String[] TITLES_PART_2 = { "to the moon!", "is crashing hard", "short squeeze imminent?",
            "DD inside", "YOLO update", "loss porn", "breaking out" };
    private static final String[] TITLES_PART_3 = { "(Real Talk)", "[Discussion]", "???", "!!1!" };

    private static final String[] COMMENTS = {
            "This is the way.",
            "Buy the dip!",
            "I like the stock.",
            "Paper hands causing this drop.",
            "Sir, this is a Wendy's.",
            "Holding until $1000.",
            "Just bought 100 more shares.",
            "F in the chat for the bears."
    };

    private TestDataGenerator() {
    }

    public static ArchivePost generatePost(String subreddit, int index, long createdUtc) {
        Random rnd = seeded(subreddit, "posts", index);
        String id = "p" + Integer.toString(Math.abs(Objects.hash(subreddit, index)), 36) + index;
        String title = pick(rnd, TITLES_PART_1) + " " + pick(rnd, TITLES_PART_2) + " " + pick(rnd, TITLES_PART_3);
        return new ArchivePost(
                id,
                subreddit,
                title,
                rnd.nextBoolean() ? "Generated body for " + id : "",
                rnd.nextInt(5000),
                createdUtc,
                "/r/" + subreddit + "/comments/" + id + "/",
                0.6 + rnd.nextInt(40) / 100.0,
                rnd.nextInt(500));
    }

    public static ArchiveComment generateComment(String subreddit, int index, long createdUtc) {
        Random rnd = seeded(subreddit, "comments", index);
        String id = "c" + Integer.toString(Math.abs(Objects.hash(subreddit, index)), 36) + index;
        String linkId = "t3_root" + rnd.nextInt(5);
        String parentId = rnd.nextInt(10) < 4 ? linkId : "t1_c" + rnd.nextInt(Math.max(1, index + 1));
        return new ArchiveComment(
                id,
                subreddit,
                pick(rnd, COMMENTS),
                rnd.nextInt(500) - 50,
                createdUtc,
                "/r/" + subreddit + "/comments/" + linkId.substring(3) + "/_/" + id + "/",
                linkId,
                parentId);
    }

    private static Random seeded(String subreddit, String kind, int index) {
        return new Random(Objects.hash(subreddit, kind, index));
    }

    private static String pick(Random rnd, String[] pool) {
        return pool[rnd.nextInt(pool.length)];
    }
}
