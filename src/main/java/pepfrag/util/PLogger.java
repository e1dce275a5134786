package pepfrag.util;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

public class PLogger {

	private static volatile PLogger instance = null;
	public final Logger logger;
	private long job_start_time = 0;

	private PLogger(){
		logger = LogManager.getLogger("pepfrag");
		job_start_time = System.currentTimeMillis();
	}

	public static PLogger getInstance() {
		if (instance == null) {
			synchronized (PLogger.class) {
				if (instance == null) {
					instance = new PLogger();
				}
			}
		}
		return instance;
	}

	public void set_job_start_time(){
		job_start_time = System.currentTimeMillis();
	}

	/**
	 * Elapsed time since {@link #set_job_start_time()} in minutes, e.g. "1.25 min".
	 */
	public String get_job_run_time(){
		long ctime = System.currentTimeMillis();
		double t = 1.0*(ctime  - job_start_time)/1000.0/60.0;
		return(String.format("%.2f",t) + " min");
	}

	/**
	 * Elapsed time in seconds since the given start time.
	 */
	public static String elapsed(long startTime){
		return String.format("%.2f s", (System.currentTimeMillis() - startTime) / 1000.0);
	}

}
