package com.example.clipscore_backend.scoring;

import com.example.clipscore_backend.scoring.profile.AuthenticityLabel;
import com.example.clipscore_backend.scoring.profile.AuthenticityLabels;
import com.example.clipscore_backend.scoring.profile.CategoryProfile;

public class AuthenticityClassifier {
    static final double HIGH_THRESHOLD = 0.7;
    static final double MID_THRESHOLD = 0.4;

    public AuthenticityLabel classify(CategoryProfile profile, double gatingValue) {
        AuthenticityLabels labels = profile.labels();
        if (gatingValue > HIGH_THRESHOLD) {
            return labels.high();
        }
        if (gatingValue > MID_THRESHOLD) {
            return labels.mid();
        }
        return labels.low();
    }
}
